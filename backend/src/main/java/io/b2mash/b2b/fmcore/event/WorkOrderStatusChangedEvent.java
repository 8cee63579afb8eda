package io.b2mash.b2b.fmcore.event;

import java.time.Instant;
import java.util.UUID;

/** Status change of a work order. The assignee fields are null while the order is unassigned. */
public record WorkOrderStatusChangedEvent(
    String eventType,
    UUID workOrderId,
    String tenantId,
    String actorId,
    String fromStatus,
    String toStatus,
    String assigneeType,
    String assigneeId,
    Instant slaDueAt,
    Instant occurredAt)
    implements DomainEvent {

  public static final String TYPE = "work_order.status_changed";
}
