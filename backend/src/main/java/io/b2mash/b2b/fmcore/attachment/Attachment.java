package io.b2mash.b2b.fmcore.attachment;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import java.time.Instant;

/** A media item on a work order. Immutable once appended. */
@Embeddable
public class Attachment {

  @Enumerated(EnumType.STRING)
  @Column(name = "category", nullable = false, length = 20)
  private AttachmentCategory category;

  @Column(name = "url", nullable = false, length = 2048)
  private String url;

  @Column(name = "uploaded_at", nullable = false)
  private Instant uploadedAt;

  @Column(name = "uploaded_by", length = 255)
  private String uploadedBy;

  protected Attachment() {}

  public Attachment(
      AttachmentCategory category, String url, Instant uploadedAt, String uploadedBy) {
    this.category = category;
    this.url = url;
    this.uploadedAt = uploadedAt;
    this.uploadedBy = uploadedBy;
  }

  public AttachmentCategory getCategory() {
    return category;
  }

  public String getUrl() {
    return url;
  }

  public Instant getUploadedAt() {
    return uploadedAt;
  }

  public String getUploadedBy() {
    return uploadedBy;
  }
}
