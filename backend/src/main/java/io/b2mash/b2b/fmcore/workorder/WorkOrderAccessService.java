package io.b2mash.b2b.fmcore.workorder;

import io.b2mash.b2b.fmcore.ability.AbilityOracle;
import io.b2mash.b2b.fmcore.actor.ActorContext;
import io.b2mash.b2b.fmcore.exception.ForbiddenException;
import io.b2mash.b2b.fmcore.exception.ResourceNotFoundException;
import io.b2mash.b2b.fmcore.multitenancy.TenantResolver;
import io.b2mash.b2b.fmcore.multitenancy.TenantScope;
import java.util.UUID;
import org.springframework.stereotype.Service;

/**
 * Guard chain shared by every work order operation: resolve the tenant, load the work order within
 * it, then ask the ability oracle. Ids that are unknown and ids owned by another tenant both
 * surface as not found.
 */
@Service
public class WorkOrderAccessService {

  private final TenantResolver tenantResolver;
  private final WorkOrderRepository workOrderRepository;
  private final AbilityOracle abilityOracle;

  public WorkOrderAccessService(
      TenantResolver tenantResolver,
      WorkOrderRepository workOrderRepository,
      AbilityOracle abilityOracle) {
    this.tenantResolver = tenantResolver;
    this.workOrderRepository = workOrderRepository;
    this.abilityOracle = abilityOracle;
  }

  /** Loads the work order and checks {@code action} against it. */
  public WorkOrder requireAccess(UUID workOrderId, ActorContext actor, WorkOrderAction action) {
    var workOrder = load(workOrderId, actor);
    requireAbility(actor, action, workOrder);
    return workOrder;
  }

  /** Loads the work order within the actor's tenant without an ability check. */
  public WorkOrder load(UUID workOrderId, ActorContext actor) {
    TenantScope scope = tenantResolver.resolve(actor);
    var workOrder =
        (scope.crossTenant() && scope.tenantId() == null
                ? workOrderRepository.findById(workOrderId)
                : workOrderRepository.findByIdAndTenantId(workOrderId, scope.tenantId()))
            .orElseThrow(() -> new ResourceNotFoundException("WorkOrder", workOrderId));
    if (!scope.covers(workOrder.getTenantId())) {
      throw new ForbiddenException(
          "Cross-tenant access denied",
          "Work order " + workOrderId + " belongs to another organization");
    }
    return workOrder;
  }

  /** Resolves the tenant and checks an action that is not tied to one work order. */
  public TenantScope requireTenantAbility(ActorContext actor, WorkOrderAction action) {
    TenantScope scope = tenantResolver.resolve(actor);
    requireAbility(actor, action, null);
    return scope;
  }

  public void requireAbility(ActorContext actor, WorkOrderAction action, WorkOrder workOrder) {
    if (!abilityOracle.can(actor, action, workOrder)) {
      throw new ForbiddenException(
          "Action not permitted",
          "Role " + actor.role() + " cannot perform action " + action.wireName());
    }
  }
}
