package io.b2mash.b2b.fmcore.assignment;

import io.b2mash.b2b.fmcore.multitenancy.RequestScopes;
import io.b2mash.b2b.fmcore.workorder.WorkOrderController.WorkOrderResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AssignmentController {

  private final AutoAssignService autoAssignService;
  private final AssignmentService assignmentService;

  public AssignmentController(
      AutoAssignService autoAssignService, AssignmentService assignmentService) {
    this.autoAssignService = autoAssignService;
    this.assignmentService = assignmentService;
  }

  @PostMapping("/api/work-orders/{id}/auto-assign")
  public ResponseEntity<AutoAssignResult> autoAssign(@PathVariable UUID id) {
    return ResponseEntity.ok(autoAssignService.autoAssign(id, RequestScopes.requireActor()));
  }

  @PostMapping("/api/work-orders/{id}/assignment")
  public ResponseEntity<WorkOrderResponse> assign(
      @PathVariable UUID id, @Valid @RequestBody AssignRequest request) {
    var workOrder =
        assignmentService.assign(
            id,
            RequestScopes.requireActor(),
            request.assigneeType(),
            request.assigneeId(),
            request.note());
    return ResponseEntity.ok(WorkOrderResponse.from(workOrder));
  }

  // --- DTOs ---

  public record AssignRequest(
      @NotNull(message = "assigneeType is required") AssigneeType assigneeType,
      @NotBlank(message = "assigneeId is required") String assigneeId,
      @Size(max = 2000, message = "note must be at most 2000 characters") String note) {}
}
