package io.b2mash.b2b.fmcore.workorder;

import io.b2mash.b2b.fmcore.actor.ActorContext;
import io.b2mash.b2b.fmcore.attachment.AttachmentCategory;
import io.b2mash.b2b.fmcore.event.WorkOrderStatusChangedEvent;
import io.b2mash.b2b.fmcore.exception.InvalidStateException;
import io.b2mash.b2b.fmcore.exception.TransitionGuardException;
import io.b2mash.b2b.fmcore.timeline.TimelineRecorder;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Applies guarded status transitions. Checks run in a fixed order: tenant and visibility, ability
 * for the action bound to the edge, terminal state, edge existence, then media and assignment
 * guards. The first failing check decides the error.
 */
@Service
public class WorkOrderLifecycleService {

  static final String REQUIRED_ASSIGNMENT = "ASSIGNMENT";

  private static final Logger log = LoggerFactory.getLogger(WorkOrderLifecycleService.class);

  private final WorkOrderAccessService accessService;
  private final WorkOrderWriter workOrderWriter;
  private final TimelineRecorder timelineRecorder;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public WorkOrderLifecycleService(
      WorkOrderAccessService accessService,
      WorkOrderWriter workOrderWriter,
      TimelineRecorder timelineRecorder,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.accessService = accessService;
    this.workOrderWriter = workOrderWriter;
    this.timelineRecorder = timelineRecorder;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  @Transactional
  public WorkOrder transition(
      UUID workOrderId, ActorContext actor, WorkOrderStatus toStatus, String note) {
    var workOrder = accessService.load(workOrderId, actor);
    var fromStatus = workOrder.getStatus();

    Optional<WorkOrderAction> action = WorkOrderAction.forTransition(fromStatus, toStatus);
    if (action.isPresent()) {
      accessService.requireAbility(actor, action.get(), workOrder);
    }

    if (fromStatus.isTerminal()) {
      throw new InvalidStateException(
          "Invalid work order state",
          "Work order is in terminal status " + fromStatus + " and cannot change status");
    }
    if (action.isEmpty() || !workOrder.canTransitionTo(toStatus)) {
      throw new InvalidStateException(
          "Invalid work order transition",
          "Cannot move work order from "
              + fromStatus
              + " to "
              + toStatus
              + "; allowed: "
              + workOrder.describeAllowedTransitions());
    }

    checkGuards(workOrder, toStatus, action.get());

    Instant now = Instant.now(clock);
    workOrder.transitionTo(toStatus, now);
    var saved = workOrderWriter.write(workOrder);

    timelineRecorder.recordTransition(saved, fromStatus, actor.actorId(), now, note);
    eventPublisher.publishEvent(
        new WorkOrderStatusChangedEvent(
            WorkOrderStatusChangedEvent.TYPE,
            saved.getId(),
            saved.getTenantId(),
            actor.actorId(),
            fromStatus.name(),
            toStatus.name(),
            saved.isAssigned() ? saved.getAssigneeType().name() : null,
            saved.getAssigneeId(),
            saved.getSlaDueAt(),
            now));

    log.info(
        "Work order {} moved {} -> {} by {} ({})",
        saved.getId(),
        fromStatus,
        toStatus,
        actor.actorId(),
        action.get().wireName());
    return saved;
  }

  /** Media completeness first, then assignment presence. */
  private void checkGuards(WorkOrder workOrder, WorkOrderStatus toStatus, WorkOrderAction action) {
    var fromStatus = workOrder.getStatus();
    if (fromStatus == WorkOrderStatus.ASSESSMENT && toStatus == WorkOrderStatus.ESTIMATE_PENDING) {
      requireAttachment(workOrder, AttachmentCategory.BEFORE);
    }
    if (fromStatus == WorkOrderStatus.IN_PROGRESS && toStatus == WorkOrderStatus.COMPLETED) {
      requireAttachment(workOrder, AttachmentCategory.AFTER);
    }
    if (action == WorkOrderAction.START_WORK && !workOrder.isAssigned()) {
      throw new TransitionGuardException(
          REQUIRED_ASSIGNMENT,
          "Missing required assignment: assign a technician or vendor before starting work");
    }
  }

  private static void requireAttachment(WorkOrder workOrder, AttachmentCategory category) {
    if (!workOrder.hasAttachment(category)) {
      throw new TransitionGuardException(
          category.name(), "Missing required attachment category: " + category.name());
    }
  }
}
