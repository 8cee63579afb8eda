package io.b2mash.b2b.fmcore.workorder;

import io.b2mash.b2b.fmcore.attachment.AttachmentController.AttachmentResponse;
import io.b2mash.b2b.fmcore.multitenancy.RequestScopes;
import io.b2mash.b2b.fmcore.timeline.TimelineEntry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class WorkOrderController {

  private final WorkOrderService workOrderService;
  private final WorkOrderLifecycleService lifecycleService;

  public WorkOrderController(
      WorkOrderService workOrderService, WorkOrderLifecycleService lifecycleService) {
    this.workOrderService = workOrderService;
    this.lifecycleService = lifecycleService;
  }

  @GetMapping("/api/work-orders/{id}")
  public ResponseEntity<WorkOrderResponse> getWorkOrder(@PathVariable UUID id) {
    var workOrder = workOrderService.getWorkOrder(id, RequestScopes.requireActor());
    return ResponseEntity.ok(WorkOrderResponse.from(workOrder));
  }

  @PostMapping("/api/work-orders/{id}/transition")
  public ResponseEntity<WorkOrderResponse> transition(
      @PathVariable UUID id, @Valid @RequestBody TransitionRequest request) {
    var workOrder =
        lifecycleService.transition(
            id, RequestScopes.requireActor(), request.toStatus(), request.note());
    return ResponseEntity.ok(WorkOrderResponse.from(workOrder));
  }

  @GetMapping("/api/work-orders/{id}/transitions")
  public ResponseEntity<List<WorkOrderService.AllowedTransition>> getAllowedTransitions(
      @PathVariable UUID id) {
    return ResponseEntity.ok(
        workOrderService.getAllowedTransitions(id, RequestScopes.requireActor()));
  }

  @GetMapping("/api/work-orders/{id}/timeline")
  public ResponseEntity<List<TimelineEntryResponse>> getTimeline(@PathVariable UUID id) {
    var entries = workOrderService.getTimeline(id, RequestScopes.requireActor());
    return ResponseEntity.ok(entries.stream().map(TimelineEntryResponse::from).toList());
  }

  @PostMapping("/api/work-orders/{id}/escalate")
  public ResponseEntity<WorkOrderResponse> escalate(
      @PathVariable UUID id, @Valid @RequestBody(required = false) EscalateRequest request) {
    var workOrder =
        request != null
            ? workOrderService.escalate(
                id, RequestScopes.requireActor(), request.priority(), request.reason())
            : workOrderService.escalate(id, RequestScopes.requireActor(), null, null);
    return ResponseEntity.ok(WorkOrderResponse.from(workOrder));
  }

  // --- DTOs ---

  public record TransitionRequest(
      @NotNull(message = "toStatus is required") WorkOrderStatus toStatus,
      @Size(max = 2000, message = "note must be at most 2000 characters") String note) {}

  public record EscalateRequest(
      WorkOrderPriority priority,
      @Size(max = 2000, message = "reason must be at most 2000 characters") String reason) {}

  public record AssignmentResponse(String assigneeType, String assigneeId, Instant assignedAt) {}

  public record WorkOrderResponse(
      UUID id,
      String tenantId,
      String title,
      String description,
      String status,
      String heldFromStatus,
      String priority,
      List<String> requiredSkills,
      AssignmentResponse assignment,
      List<AttachmentResponse> attachments,
      Instant slaDueAt,
      int escalationCount,
      int version,
      Instant createdAt,
      Instant updatedAt,
      Instant completedAt) {

    public static WorkOrderResponse from(WorkOrder workOrder) {
      return new WorkOrderResponse(
          workOrder.getId(),
          workOrder.getTenantId(),
          workOrder.getTitle(),
          workOrder.getDescription(),
          workOrder.getStatus().name(),
          workOrder.getHeldFromStatus() != null ? workOrder.getHeldFromStatus().name() : null,
          workOrder.getPriority().name(),
          workOrder.getRequiredSkills(),
          workOrder.isAssigned()
              ? new AssignmentResponse(
                  workOrder.getAssigneeType().name(),
                  workOrder.getAssigneeId(),
                  workOrder.getAssignedAt())
              : null,
          workOrder.getAttachments().stream().map(AttachmentResponse::from).toList(),
          workOrder.getSlaDueAt(),
          workOrder.getEscalationCount(),
          workOrder.getVersion(),
          workOrder.getCreatedAt(),
          workOrder.getUpdatedAt(),
          workOrder.getCompletedAt());
    }
  }

  public record TimelineEntryResponse(
      UUID id,
      UUID workOrderId,
      String fromStatus,
      String toStatus,
      String actorId,
      Instant occurredAt,
      String note) {

    public static TimelineEntryResponse from(TimelineEntry entry) {
      return new TimelineEntryResponse(
          entry.getId(),
          entry.getWorkOrderId(),
          entry.getFromStatus().name(),
          entry.getToStatus().name(),
          entry.getActorId(),
          entry.getOccurredAt(),
          entry.getNote());
    }
  }
}
