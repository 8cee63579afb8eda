package io.b2mash.b2b.fmcore.timeline;

import io.b2mash.b2b.fmcore.workorder.WorkOrder;
import io.b2mash.b2b.fmcore.workorder.WorkOrderStatus;
import java.time.Instant;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class TimelineRecorder {

  private final TimelineEntryRepository timelineEntryRepository;

  public TimelineRecorder(TimelineEntryRepository timelineEntryRepository) {
    this.timelineEntryRepository = timelineEntryRepository;
  }

  /** Appends a status change. */
  public TimelineEntry recordTransition(
      WorkOrder workOrder,
      WorkOrderStatus fromStatus,
      String actorId,
      Instant occurredAt,
      String note) {
    return timelineEntryRepository.save(
        new TimelineEntry(
            workOrder.getId(),
            workOrder.getTenantId(),
            fromStatus,
            workOrder.getStatus(),
            actorId,
            occurredAt,
            note));
  }

  /** Appends a change that left the status untouched, such as an assignment or escalation. */
  public TimelineEntry recordNote(
      WorkOrder workOrder, String actorId, Instant occurredAt, String note) {
    return recordTransition(workOrder, workOrder.getStatus(), actorId, occurredAt, note);
  }

  public List<TimelineEntry> history(WorkOrder workOrder) {
    return timelineEntryRepository.findByWorkOrderIdAndTenantIdOrderByOccurredAtAsc(
        workOrder.getId(), workOrder.getTenantId());
  }
}
