package io.b2mash.b2b.fmcore.workorder;

import java.util.Map;
import java.util.Set;

/**
 * Work order lifecycle status. The static graph below covers every edge except resuming from
 * {@link #ON_HOLD}, whose target depends on the state the work order was paused from; see {@link
 * WorkOrder#allowedTransitions()}.
 */
public enum WorkOrderStatus {
  REPORTED,
  ASSESSMENT,
  ESTIMATE_PENDING,
  APPROVED,
  IN_PROGRESS,
  COMPLETED,
  ON_HOLD,
  CANCELLED;

  private static final Map<WorkOrderStatus, Set<WorkOrderStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          REPORTED, Set.of(ASSESSMENT, ON_HOLD, CANCELLED),
          ASSESSMENT, Set.of(ESTIMATE_PENDING, ON_HOLD, CANCELLED),
          ESTIMATE_PENDING, Set.of(APPROVED, ON_HOLD, CANCELLED),
          APPROVED, Set.of(IN_PROGRESS, ON_HOLD, CANCELLED),
          IN_PROGRESS, Set.of(COMPLETED, ON_HOLD, CANCELLED),
          ON_HOLD, Set.of(CANCELLED),
          COMPLETED, Set.of(),
          CANCELLED, Set.of());

  /** Returns the statically known targets from this status. */
  public Set<WorkOrderStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  /** Returns true if this is a terminal state (COMPLETED or CANCELLED). */
  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED;
  }
}
