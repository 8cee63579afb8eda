package io.b2mash.b2b.fmcore.workorder;

import io.b2mash.b2b.fmcore.event.WorkOrderAssignedEvent;
import io.b2mash.b2b.fmcore.event.WorkOrderStatusChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Reports SLA breaches once a status change has committed. Runs after commit, so nothing here can
 * undo or fail the transition that triggered it.
 */
@Component
public class WorkOrderSlaMonitor {

  private static final Logger log = LoggerFactory.getLogger(WorkOrderSlaMonitor.class);

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onStatusChanged(WorkOrderStatusChangedEvent event) {
    if (isBreach(event)) {
      log.warn(
          "SLA breached: workOrder={}, tenant={}, status={}, dueAt={}, changedAt={}",
          event.workOrderId(),
          event.tenantId(),
          event.toStatus(),
          event.slaDueAt(),
          event.occurredAt());
    }
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onAssigned(WorkOrderAssignedEvent event) {
    log.info(
        "Work order {} {} to {} {} by {}",
        event.workOrderId(),
        event.automatic() ? "auto-assigned" : "assigned",
        event.assigneeType(),
        event.assigneeId(),
        event.actorId());
  }

  static boolean isBreach(WorkOrderStatusChangedEvent event) {
    return event.slaDueAt() != null
        && !WorkOrderStatus.CANCELLED.name().equals(event.toStatus())
        && event.occurredAt().isAfter(event.slaDueAt());
  }
}
