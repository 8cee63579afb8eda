package io.b2mash.b2b.fmcore.ability;

import io.b2mash.b2b.fmcore.actor.ActorContext;
import io.b2mash.b2b.fmcore.actor.ActorRole;
import io.b2mash.b2b.fmcore.assignment.AssigneeType;
import io.b2mash.b2b.fmcore.workorder.WorkOrder;
import io.b2mash.b2b.fmcore.workorder.WorkOrderAction;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Static role table. Field roles (technicians and vendors) get their actions only on work orders
 * currently assigned to them.
 */
@Component
public class RoleBasedAbilityOracle implements AbilityOracle {

  private static final Set<WorkOrderAction> ALL = EnumSet.allOf(WorkOrderAction.class);

  private static final Set<WorkOrderAction> FIELD_ACTIONS =
      EnumSet.of(
          WorkOrderAction.SUBMIT_ESTIMATE,
          WorkOrderAction.START_WORK,
          WorkOrderAction.COMPLETE_WORK,
          WorkOrderAction.ATTACH_MEDIA,
          WorkOrderAction.PUT_ON_HOLD,
          WorkOrderAction.RESUME,
          WorkOrderAction.VIEW);

  private static final Map<ActorRole, Set<WorkOrderAction>> ROLE_ACTIONS =
      Map.of(
          ActorRole.SUPER_ADMIN, ALL,
          ActorRole.ADMIN, ALL,
          ActorRole.PROPERTY_MANAGER, ALL,
          ActorRole.TEAM_MEMBER, EnumSet.complementOf(EnumSet.of(WorkOrderAction.APPROVE)),
          ActorRole.CORPORATE_OWNER,
              EnumSet.of(
                  WorkOrderAction.APPROVE,
                  WorkOrderAction.CANCEL,
                  WorkOrderAction.ESCALATE,
                  WorkOrderAction.VIEW,
                  WorkOrderAction.VIEW_STATS),
          ActorRole.TECHNICIAN, FIELD_ACTIONS,
          ActorRole.VENDOR, FIELD_ACTIONS,
          ActorRole.TENANT, EnumSet.of(WorkOrderAction.VIEW, WorkOrderAction.ATTACH_MEDIA));

  @Override
  public boolean can(ActorContext actor, WorkOrderAction action, WorkOrder workOrder) {
    if (actor == null || actor.role() == null) {
      return false;
    }
    if (!ROLE_ACTIONS.getOrDefault(actor.role(), Set.of()).contains(action)) {
      return false;
    }
    if (actor.role().isFieldRole()) {
      return workOrder != null
          && workOrder.isAssignedTo(assigneeTypeOf(actor.role()), actor.actorId());
    }
    return true;
  }

  private static AssigneeType assigneeTypeOf(ActorRole role) {
    return role == ActorRole.VENDOR ? AssigneeType.VENDOR : AssigneeType.USER;
  }
}
