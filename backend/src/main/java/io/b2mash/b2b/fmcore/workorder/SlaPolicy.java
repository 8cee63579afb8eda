package io.b2mash.b2b.fmcore.workorder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class SlaPolicy {

  private final SlaProperties properties;

  public SlaPolicy(SlaProperties properties) {
    this.properties = properties;
  }

  public Duration resolutionWindow(WorkOrderPriority priority) {
    Integer hours = properties.resolutionHours().get(priority);
    return Duration.ofHours(hours != null ? hours : priority.defaultSlaHours());
  }

  /** Deadline for a work order of {@code priority} created at {@code createdAt}. */
  public Instant dueAt(Instant createdAt, WorkOrderPriority priority) {
    return createdAt.plus(resolutionWindow(priority));
  }

  /**
   * Intake path for new work orders: a missing {@code slaDueAt} is taken from the configured
   * resolution window of the (defaulted) priority.
   */
  public WorkOrder open(
      String tenantId,
      String title,
      String description,
      WorkOrderPriority priority,
      List<String> requiredSkills,
      Instant slaDueAt,
      Instant createdAt) {
    var effectivePriority = priority != null ? priority : WorkOrderPriority.MEDIUM;
    var deadline = slaDueAt != null ? slaDueAt : dueAt(createdAt, effectivePriority);
    return new WorkOrder(
        tenantId, title, description, effectivePriority, requiredSkills, deadline, createdAt);
  }
}
