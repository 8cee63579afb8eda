package io.b2mash.b2b.fmcore.attachment;

import io.b2mash.b2b.fmcore.multitenancy.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
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
public class AttachmentController {

  private final AttachmentService attachmentService;

  public AttachmentController(AttachmentService attachmentService) {
    this.attachmentService = attachmentService;
  }

  @PostMapping("/api/work-orders/{id}/attachments")
  public ResponseEntity<List<AttachmentResponse>> addAttachment(
      @PathVariable UUID id, @Valid @RequestBody AddAttachmentRequest request) {
    var attachments =
        attachmentService.addAttachment(
            id, RequestScopes.requireActor(), request.category(), request.url());
    return ResponseEntity.created(URI.create("/api/work-orders/" + id + "/attachments"))
        .body(attachments.stream().map(AttachmentResponse::from).toList());
  }

  @GetMapping("/api/work-orders/{id}/attachments")
  public ResponseEntity<List<AttachmentResponse>> listAttachments(@PathVariable UUID id) {
    var attachments = attachmentService.listAttachments(id, RequestScopes.requireActor());
    return ResponseEntity.ok(attachments.stream().map(AttachmentResponse::from).toList());
  }

  // --- DTOs ---

  public record AddAttachmentRequest(
      @NotNull(message = "category is required") AttachmentCategory category,
      @NotBlank(message = "url is required")
          @Size(max = 2048, message = "url must be at most 2048 characters")
          String url) {}

  public record AttachmentResponse(
      String category, String url, Instant uploadedAt, String uploadedBy) {

    public static AttachmentResponse from(Attachment attachment) {
      return new AttachmentResponse(
          attachment.getCategory().name(),
          attachment.getUrl(),
          attachment.getUploadedAt(),
          attachment.getUploadedBy());
    }
  }
}
