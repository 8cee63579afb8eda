package io.b2mash.b2b.fmcore.ability;

import io.b2mash.b2b.fmcore.actor.ActorContext;
import io.b2mash.b2b.fmcore.workorder.WorkOrder;
import io.b2mash.b2b.fmcore.workorder.WorkOrderAction;

/**
 * Decides whether an actor may perform an action. Role rules and business-specific denials (a
 * technician acting on work that is not theirs) live behind this interface so the lifecycle engine
 * stays free of role branching.
 */
public interface AbilityOracle {

  /**
   * @param workOrder the target work order, or null for actions not tied to a single work order
   *     (such as {@code view_stats})
   */
  boolean can(ActorContext actor, WorkOrderAction action, WorkOrder workOrder);
}
