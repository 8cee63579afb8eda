package io.b2mash.b2b.fmcore.workorder;

import io.b2mash.b2b.fmcore.actor.ActorContext;
import io.b2mash.b2b.fmcore.exception.InvalidStateException;
import io.b2mash.b2b.fmcore.timeline.TimelineEntry;
import io.b2mash.b2b.fmcore.timeline.TimelineRecorder;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class WorkOrderService {

  private static final Logger log = LoggerFactory.getLogger(WorkOrderService.class);

  private final WorkOrderAccessService accessService;
  private final WorkOrderWriter workOrderWriter;
  private final TimelineRecorder timelineRecorder;
  private final SlaPolicy slaPolicy;
  private final Clock clock;

  public WorkOrderService(
      WorkOrderAccessService accessService,
      WorkOrderWriter workOrderWriter,
      TimelineRecorder timelineRecorder,
      SlaPolicy slaPolicy,
      Clock clock) {
    this.accessService = accessService;
    this.workOrderWriter = workOrderWriter;
    this.timelineRecorder = timelineRecorder;
    this.slaPolicy = slaPolicy;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public WorkOrder getWorkOrder(UUID workOrderId, ActorContext actor) {
    return accessService.requireAccess(workOrderId, actor, WorkOrderAction.VIEW);
  }

  @Transactional(readOnly = true)
  public List<TimelineEntry> getTimeline(UUID workOrderId, ActorContext actor) {
    var workOrder = accessService.requireAccess(workOrderId, actor, WorkOrderAction.VIEW);
    return timelineRecorder.history(workOrder);
  }

  /** Edges available from the current status, in workflow order, with the action each requires. */
  @Transactional(readOnly = true)
  public List<AllowedTransition> getAllowedTransitions(UUID workOrderId, ActorContext actor) {
    var workOrder = accessService.requireAccess(workOrderId, actor, WorkOrderAction.VIEW);
    return workOrder.allowedTransitions().stream()
        .sorted(Comparator.naturalOrder())
        .map(
            target ->
                new AllowedTransition(
                    target,
                    WorkOrderAction.forTransition(workOrder.getStatus(), target).orElseThrow()))
        .toList();
  }

  /**
   * Raises the priority to {@code targetPriority}, or one level when null, and recomputes the SLA
   * deadline from the creation time. A non-blank {@code reason} is appended to the timeline note.
   */
  @Transactional
  public WorkOrder escalate(
      UUID workOrderId, ActorContext actor, WorkOrderPriority targetPriority, String reason) {
    var workOrder = accessService.requireAccess(workOrderId, actor, WorkOrderAction.ESCALATE);
    var fromPriority = workOrder.getPriority();
    var target = targetPriority != null ? targetPriority : fromPriority.next();
    if (target == null) {
      throw new InvalidStateException(
          "Invalid escalation", "Work order is already at the highest priority " + fromPriority);
    }

    Instant now = Instant.now(clock);
    workOrder.escalate(target, slaPolicy.dueAt(workOrder.getCreatedAt(), target), now);
    var saved = workOrderWriter.write(workOrder);
    var note = "escalated from " + fromPriority + " to " + target;
    if (reason != null && !reason.isBlank()) {
      note += ": " + reason.strip();
    }
    timelineRecorder.recordNote(saved, actor.actorId(), now, note);

    log.info(
        "Work order {} escalated {} -> {} by {} (escalation #{}), SLA due {}",
        saved.getId(),
        fromPriority,
        target,
        actor.actorId(),
        saved.getEscalationCount(),
        saved.getSlaDueAt());
    return saved;
  }

  public record AllowedTransition(WorkOrderStatus toStatus, WorkOrderAction action) {}
}
