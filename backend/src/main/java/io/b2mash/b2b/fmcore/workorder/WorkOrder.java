package io.b2mash.b2b.fmcore.workorder;

import io.b2mash.b2b.fmcore.assignment.AssigneeType;
import io.b2mash.b2b.fmcore.attachment.Attachment;
import io.b2mash.b2b.fmcore.attachment.AttachmentCategory;
import io.b2mash.b2b.fmcore.exception.InvalidStateException;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "work_orders")
public class WorkOrder {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, updatable = false)
  private String tenantId;

  @Column(name = "title", nullable = false, length = 500)
  private String title;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private WorkOrderStatus status;

  @Enumerated(EnumType.STRING)
  @Column(name = "held_from_status", length = 20)
  private WorkOrderStatus heldFromStatus;

  @Enumerated(EnumType.STRING)
  @Column(name = "priority", nullable = false, length = 20)
  private WorkOrderPriority priority;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "required_skills", columnDefinition = "jsonb", nullable = false)
  private List<String> requiredSkills = new ArrayList<>();

  @Enumerated(EnumType.STRING)
  @Column(name = "assignee_type", length = 20)
  private AssigneeType assigneeType;

  @Column(name = "assignee_id")
  private String assigneeId;

  @Column(name = "assigned_at")
  private Instant assignedAt;

  @Column(name = "assigned_by")
  private String assignedBy;

  @Column(name = "sla_due_at")
  private Instant slaDueAt;

  @Column(name = "escalation_count", nullable = false)
  private int escalationCount;

  // Loaded eagerly: responses are mapped after the transaction closes
  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(
      name = "work_order_attachments",
      joinColumns = @JoinColumn(name = "work_order_id"))
  @OrderColumn(name = "sort_order")
  private List<Attachment> attachments = new ArrayList<>();

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Column(name = "completed_at")
  private Instant completedAt;

  protected WorkOrder() {}

  /**
   * Creates a work order in {@link WorkOrderStatus#REPORTED}. Without an explicit {@code slaDueAt}
   * the deadline is {@code createdAt} plus the priority's default resolution window; use {@link
   * SlaPolicy#open} to honour configured windows instead.
   */
  public WorkOrder(
      String tenantId,
      String title,
      String description,
      WorkOrderPriority priority,
      List<String> requiredSkills,
      Instant slaDueAt,
      Instant createdAt) {
    this.tenantId = tenantId;
    this.title = title;
    this.description = description;
    this.status = WorkOrderStatus.REPORTED;
    this.priority = priority != null ? priority : WorkOrderPriority.MEDIUM;
    this.requiredSkills =
        requiredSkills != null ? new ArrayList<>(requiredSkills) : new ArrayList<>();
    this.slaDueAt =
        slaDueAt != null || createdAt == null
            ? slaDueAt
            : createdAt.plus(Duration.ofHours(this.priority.defaultSlaHours()));
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  /**
   * Returns the targets reachable from the current status. A work order on hold may only resume
   * into the status it was paused from, or be cancelled.
   */
  public Set<WorkOrderStatus> allowedTransitions() {
    if (status == WorkOrderStatus.ON_HOLD) {
      var targets = EnumSet.of(WorkOrderStatus.CANCELLED);
      if (heldFromStatus != null) {
        targets.add(heldFromStatus);
      }
      return Collections.unmodifiableSet(targets);
    }
    return status.allowedTransitions();
  }

  public boolean canTransitionTo(WorkOrderStatus target) {
    return allowedTransitions().contains(target);
  }

  /**
   * Moves the work order to {@code target}. Only the lifecycle engine calls this, after ability and
   * guard checks; the edge itself is still enforced here.
   */
  void transitionTo(WorkOrderStatus target, Instant now) {
    requireNotTerminal("change status of");
    if (!canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid work order transition",
          "Cannot move work order from " + status + " to " + target);
    }
    if (target == WorkOrderStatus.ON_HOLD) {
      this.heldFromStatus = status;
    } else if (status == WorkOrderStatus.ON_HOLD) {
      this.heldFromStatus = null;
    }
    if (target == WorkOrderStatus.COMPLETED && completedAt == null) {
      this.completedAt = now;
    }
    this.status = target;
    this.updatedAt = now;
  }

  /** Records who the work order is assigned to, replacing any previous assignment. */
  public void assign(AssigneeType type, String assigneeId, String assignedBy, Instant now) {
    requireNotTerminal("assign");
    this.assigneeType = type;
    this.assigneeId = assigneeId;
    this.assignedBy = assignedBy;
    this.assignedAt = now;
    this.updatedAt = now;
  }

  /** Appends a media item. Attachments are never removed. */
  public void addAttachment(Attachment attachment) {
    this.attachments.add(attachment);
    this.updatedAt = attachment.getUploadedAt();
  }

  /** Raises the priority and replaces the SLA deadline. */
  public void escalate(WorkOrderPriority target, Instant newSlaDueAt, Instant now) {
    requireNotTerminal("escalate");
    if (!target.isAbove(priority)) {
      throw new InvalidStateException(
          "Invalid escalation",
          "Cannot escalate work order from " + priority + " to " + target);
    }
    this.priority = target;
    this.slaDueAt = newSlaDueAt;
    this.escalationCount++;
    this.updatedAt = now;
  }

  public boolean hasAttachment(AttachmentCategory category) {
    return attachments.stream().anyMatch(a -> a.getCategory() == category);
  }

  public boolean isAssigned() {
    return assigneeType != null && assigneeId != null;
  }

  public boolean isAssignedTo(AssigneeType type, String id) {
    return isAssigned() && assigneeType == type && assigneeId.equals(id);
  }

  /** True while open work has passed its SLA deadline. */
  public boolean isOverdue(Instant now) {
    return slaDueAt != null && !status.isTerminal() && slaDueAt.isBefore(now);
  }

  public String describeAllowedTransitions() {
    return allowedTransitions().stream()
        .sorted()
        .map(Enum::name)
        .collect(Collectors.joining(", ", "[", "]"));
  }

  private void requireNotTerminal(String action) {
    if (status.isTerminal()) {
      throw new InvalidStateException(
          "Invalid work order state", "Cannot " + action + " work order in status " + status);
    }
  }

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public WorkOrderStatus getStatus() {
    return status;
  }

  public WorkOrderStatus getHeldFromStatus() {
    return heldFromStatus;
  }

  public WorkOrderPriority getPriority() {
    return priority;
  }

  public List<String> getRequiredSkills() {
    return Collections.unmodifiableList(requiredSkills);
  }

  public AssigneeType getAssigneeType() {
    return assigneeType;
  }

  public String getAssigneeId() {
    return assigneeId;
  }

  public Instant getAssignedAt() {
    return assignedAt;
  }

  public String getAssignedBy() {
    return assignedBy;
  }

  public Instant getSlaDueAt() {
    return slaDueAt;
  }

  public int getEscalationCount() {
    return escalationCount;
  }

  public List<Attachment> getAttachments() {
    return Collections.unmodifiableList(attachments);
  }

  public int getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }
}
