package io.b2mash.b2b.fmcore.event;

import java.time.Instant;
import java.util.UUID;

public record WorkOrderAssignedEvent(
    String eventType,
    UUID workOrderId,
    String tenantId,
    String actorId,
    String assigneeType,
    String assigneeId,
    boolean automatic,
    Instant occurredAt)
    implements DomainEvent {

  public static final String TYPE = "work_order.assigned";
}
