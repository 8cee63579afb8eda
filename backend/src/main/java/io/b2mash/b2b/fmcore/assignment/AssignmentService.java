package io.b2mash.b2b.fmcore.assignment;

import io.b2mash.b2b.fmcore.actor.ActorContext;
import io.b2mash.b2b.fmcore.event.WorkOrderAssignedEvent;
import io.b2mash.b2b.fmcore.exception.InvalidStateException;
import io.b2mash.b2b.fmcore.exception.ResourceNotFoundException;
import io.b2mash.b2b.fmcore.timeline.TimelineRecorder;
import io.b2mash.b2b.fmcore.workorder.WorkOrder;
import io.b2mash.b2b.fmcore.workorder.WorkOrderAccessService;
import io.b2mash.b2b.fmcore.workorder.WorkOrderAction;
import io.b2mash.b2b.fmcore.workorder.WorkOrderWriter;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Manual assignment, the fallback when auto-assignment is off or finds nobody. */
@Service
public class AssignmentService {

  static final String TIMELINE_NOTE = "assigned";

  private static final Logger log = LoggerFactory.getLogger(AssignmentService.class);

  private final WorkOrderAccessService accessService;
  private final AssigneeRepository assigneeRepository;
  private final AssigneeWorkload assigneeWorkload;
  private final WorkOrderWriter workOrderWriter;
  private final TimelineRecorder timelineRecorder;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public AssignmentService(
      WorkOrderAccessService accessService,
      AssigneeRepository assigneeRepository,
      AssigneeWorkload assigneeWorkload,
      WorkOrderWriter workOrderWriter,
      TimelineRecorder timelineRecorder,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.accessService = accessService;
    this.assigneeRepository = assigneeRepository;
    this.assigneeWorkload = assigneeWorkload;
    this.workOrderWriter = workOrderWriter;
    this.timelineRecorder = timelineRecorder;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  @Transactional
  public WorkOrder assign(
      UUID workOrderId,
      ActorContext actor,
      AssigneeType assigneeType,
      String assigneeId,
      String note) {
    var workOrder = accessService.requireAccess(workOrderId, actor, WorkOrderAction.ASSIGN);
    var assignee =
        assigneeRepository
            .findByIdAndTenantId(assigneeId, workOrder.getTenantId())
            .filter(a -> a.getType() == assigneeType)
            .orElseThrow(() -> new ResourceNotFoundException("Assignee", assigneeId));
    if (assignee.getAvailability() == Availability.OFFLINE) {
      throw new InvalidStateException(
          "Assignee unavailable", "Assignee " + assigneeId + " is offline and cannot be assigned");
    }

    var previousType = workOrder.getAssigneeType();
    var previousId = workOrder.getAssigneeId();
    Instant now = Instant.now(clock);
    workOrder.assign(assignee.getType(), assignee.getId(), actor.actorId(), now);
    var saved = workOrderWriter.write(workOrder);
    assigneeWorkload.reassign(saved.getTenantId(), previousType, previousId, assignee);
    timelineRecorder.recordNote(
        saved, actor.actorId(), now, note != null && !note.isBlank() ? note : TIMELINE_NOTE);
    eventPublisher.publishEvent(
        new WorkOrderAssignedEvent(
            WorkOrderAssignedEvent.TYPE,
            saved.getId(),
            saved.getTenantId(),
            actor.actorId(),
            assignee.getType().name(),
            assignee.getId(),
            false,
            now));

    log.info(
        "Work order {} assigned to {} {} by {}",
        saved.getId(),
        assignee.getType(),
        assignee.getId(),
        actor.actorId());
    return saved;
  }
}
