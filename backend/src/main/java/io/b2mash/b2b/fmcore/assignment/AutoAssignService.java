package io.b2mash.b2b.fmcore.assignment;

import io.b2mash.b2b.fmcore.actor.ActorContext;
import io.b2mash.b2b.fmcore.event.WorkOrderAssignedEvent;
import io.b2mash.b2b.fmcore.exception.InvalidStateException;
import io.b2mash.b2b.fmcore.exception.ResourceNotFoundException;
import io.b2mash.b2b.fmcore.timeline.TimelineRecorder;
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

@Service
public class AutoAssignService {

  static final String TIMELINE_NOTE = "auto-assigned";

  private static final Logger log = LoggerFactory.getLogger(AutoAssignService.class);

  private final WorkOrderAccessService accessService;
  private final RoutingModeResolver routingModeResolver;
  private final AssigneeRepository assigneeRepository;
  private final AssigneeWorkload assigneeWorkload;
  private final WorkOrderWriter workOrderWriter;
  private final TimelineRecorder timelineRecorder;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public AutoAssignService(
      WorkOrderAccessService accessService,
      RoutingModeResolver routingModeResolver,
      AssigneeRepository assigneeRepository,
      AssigneeWorkload assigneeWorkload,
      WorkOrderWriter workOrderWriter,
      TimelineRecorder timelineRecorder,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.accessService = accessService;
    this.routingModeResolver = routingModeResolver;
    this.assigneeRepository = assigneeRepository;
    this.assigneeWorkload = assigneeWorkload;
    this.workOrderWriter = workOrderWriter;
    this.timelineRecorder = timelineRecorder;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /**
   * Picks the best-ranked candidate and assigns the work order to it, charging the winner's
   * workload. When the routing mode is {@link RoutingMode.Disabled} the result is a failure for
   * every work order, terminal ones included, and the candidate pool is never read.
   */
  @Transactional
  public AutoAssignResult autoAssign(UUID workOrderId, ActorContext actor) {
    var workOrder = accessService.requireAccess(workOrderId, actor, WorkOrderAction.AUTO_ASSIGN);

    // A disabled mode answers the same way whatever state the order is in
    RoutingMode mode = routingModeResolver.resolve();
    if (!(mode instanceof RoutingMode.Heuristic heuristic)) {
      log.debug("Auto-assignment disabled, work order {} left unassigned", workOrderId);
      return AutoAssignResult.failed(AutoAssignResult.DISABLED);
    }

    if (workOrder.getStatus().isTerminal()) {
      throw new InvalidStateException(
          "Invalid work order state",
          "Cannot auto-assign work order in status " + workOrder.getStatus());
    }

    var ranked = heuristic.strategy().rank(workOrder);
    if (ranked.isEmpty()) {
      log.info("No eligible candidates for work order {}", workOrderId);
      return AutoAssignResult.failed(AutoAssignResult.NO_CANDIDATES);
    }

    var winner = ranked.get(0);
    var assignee =
        assigneeRepository
            .findByIdAndTenantId(winner.id(), workOrder.getTenantId())
            .orElseThrow(() -> new ResourceNotFoundException("Assignee", winner.id()));
    var previousType = workOrder.getAssigneeType();
    var previousId = workOrder.getAssigneeId();
    Instant now = Instant.now(clock);
    workOrder.assign(winner.type(), winner.id(), actor.actorId(), now);
    var saved = workOrderWriter.write(workOrder);
    assigneeWorkload.reassign(saved.getTenantId(), previousType, previousId, assignee);
    timelineRecorder.recordNote(saved, actor.actorId(), now, TIMELINE_NOTE);
    eventPublisher.publishEvent(
        new WorkOrderAssignedEvent(
            WorkOrderAssignedEvent.TYPE,
            saved.getId(),
            saved.getTenantId(),
            actor.actorId(),
            winner.type().name(),
            winner.id(),
            true,
            now));

    log.info(
        "Work order {} auto-assigned to {} {} (score={}, mode={})",
        saved.getId(),
        winner.type(),
        winner.id(),
        winner.score(),
        mode.wireName());
    return AutoAssignResult.assigned(winner, mode.wireName());
  }
}
