package io.b2mash.b2b.fmcore.timeline;

import io.b2mash.b2b.fmcore.workorder.WorkOrderStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/**
 * Append-only record of an accepted change to a work order. Rows are never updated or deleted; the
 * database enforces this with a trigger on {@code work_order_timeline}.
 */
@Entity
@Immutable
@Table(name = "work_order_timeline")
public class TimelineEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "work_order_id", nullable = false, updatable = false)
  private UUID workOrderId;

  @Column(name = "tenant_id", nullable = false, updatable = false)
  private String tenantId;

  @Enumerated(EnumType.STRING)
  @Column(name = "from_status", nullable = false, updatable = false, length = 20)
  private WorkOrderStatus fromStatus;

  @Enumerated(EnumType.STRING)
  @Column(name = "to_status", nullable = false, updatable = false, length = 20)
  private WorkOrderStatus toStatus;

  @Column(name = "actor_id", nullable = false, updatable = false)
  private String actorId;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  @Column(name = "note", updatable = false, columnDefinition = "TEXT")
  private String note;

  protected TimelineEntry() {}

  public TimelineEntry(
      UUID workOrderId,
      String tenantId,
      WorkOrderStatus fromStatus,
      WorkOrderStatus toStatus,
      String actorId,
      Instant occurredAt,
      String note) {
    this.workOrderId = workOrderId;
    this.tenantId = tenantId;
    this.fromStatus = fromStatus;
    this.toStatus = toStatus;
    this.actorId = actorId;
    this.occurredAt = occurredAt;
    this.note = note;
  }

  public UUID getId() {
    return id;
  }

  public UUID getWorkOrderId() {
    return workOrderId;
  }

  public String getTenantId() {
    return tenantId;
  }

  public WorkOrderStatus getFromStatus() {
    return fromStatus;
  }

  public WorkOrderStatus getToStatus() {
    return toStatus;
  }

  public String getActorId() {
    return actorId;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }

  public String getNote() {
    return note;
  }
}
