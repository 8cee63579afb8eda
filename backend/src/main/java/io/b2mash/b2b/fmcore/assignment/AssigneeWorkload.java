package io.b2mash.b2b.fmcore.assignment;

import io.b2mash.b2b.fmcore.event.WorkOrderStatusChangedEvent;
import io.b2mash.b2b.fmcore.exception.ResourceConflictException;
import io.b2mash.b2b.fmcore.workorder.WorkOrderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Keeps {@link Assignee#getCurrentWorkload()} at one unit per open work order. Every change is
 * written through the assignee's {@code version} column, so two dispatchers holding the same
 * assignee cannot both store a stale count; the loser gets a {@link ResourceConflictException}.
 */
@Component
public class AssigneeWorkload {

  private static final Logger log = LoggerFactory.getLogger(AssigneeWorkload.class);

  private final AssigneeRepository assigneeRepository;

  public AssigneeWorkload(AssigneeRepository assigneeRepository) {
    this.assigneeRepository = assigneeRepository;
  }

  /**
   * Charges {@code next} with the work order and releases the previous holder. Re-assigning to the
   * current holder changes nothing.
   */
  void reassign(String tenantId, AssigneeType previousType, String previousId, Assignee next) {
    if (next.getType() == previousType && next.getId().equals(previousId)) {
      return;
    }
    if (previousType != null) {
      release(tenantId, previousType, previousId);
    }
    next.takeOn();
    write(next);
  }

  void release(String tenantId, AssigneeType type, String assigneeId) {
    assigneeRepository
        .findByIdAndTenantId(assigneeId, tenantId)
        .filter(assignee -> assignee.getType() == type)
        .ifPresentOrElse(
            assignee -> {
              assignee.release();
              write(assignee);
            },
            () ->
                log.warn(
                    "Assignee {} {} is no longer registered with tenant {}, workload not released",
                    type,
                    assigneeId,
                    tenantId));
  }

  /**
   * Releases the holder of a work order that reached a terminal status. Runs before the transition
   * commits, so a lost workload update rolls the transition back.
   */
  @TransactionalEventListener(phase = TransactionPhase.BEFORE_COMMIT)
  public void onStatusChanged(WorkOrderStatusChangedEvent event) {
    if (event.assigneeId() == null || !WorkOrderStatus.valueOf(event.toStatus()).isTerminal()) {
      return;
    }
    release(event.tenantId(), AssigneeType.valueOf(event.assigneeType()), event.assigneeId());
  }

  private void write(Assignee assignee) {
    try {
      assigneeRepository.saveAndFlush(assignee);
    } catch (ObjectOptimisticLockingFailureException e) {
      log.warn(
          "Lost concurrent workload update on assignee {} at version {}",
          assignee.getId(),
          assignee.getVersion());
      throw new ResourceConflictException(
          "Concurrent modification",
          "Assignee " + assignee.getId() + " was modified concurrently. Reload and retry.");
    }
  }
}
