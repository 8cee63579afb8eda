package io.b2mash.b2b.fmcore.workorder;

import io.b2mash.b2b.fmcore.exception.ResourceConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;

/**
 * Single write path for work orders. The flush compares the {@code version} column read with the
 * entity, so a concurrent writer that committed first turns this write into a {@link
 * ResourceConflictException}. Writes are never retried here.
 */
@Component
public class WorkOrderWriter {

  private static final Logger log = LoggerFactory.getLogger(WorkOrderWriter.class);

  private final WorkOrderRepository workOrderRepository;

  public WorkOrderWriter(WorkOrderRepository workOrderRepository) {
    this.workOrderRepository = workOrderRepository;
  }

  public WorkOrder write(WorkOrder workOrder) {
    try {
      return workOrderRepository.saveAndFlush(workOrder);
    } catch (ObjectOptimisticLockingFailureException e) {
      log.warn(
          "Lost concurrent update on work order {} at version {}",
          workOrder.getId(),
          workOrder.getVersion());
      throw new ResourceConflictException(
          "Concurrent modification",
          "Work order " + workOrder.getId() + " was modified concurrently. Reload and retry.");
    }
  }
}
