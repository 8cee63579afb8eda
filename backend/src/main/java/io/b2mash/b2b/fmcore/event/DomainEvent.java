package io.b2mash.b2b.fmcore.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for domain events published via Spring ApplicationEventPublisher. Implementations
 * are records with primitive, String or UUID fields only, so they stay valid after the publishing
 * transaction commits and the persistence context closes.
 */
public sealed interface DomainEvent permits WorkOrderStatusChangedEvent, WorkOrderAssignedEvent {

  String eventType();

  UUID workOrderId();

  String tenantId();

  String actorId();

  Instant occurredAt();
}
