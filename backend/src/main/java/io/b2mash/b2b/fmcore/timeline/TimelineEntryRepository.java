package io.b2mash.b2b.fmcore.timeline;

import java.util.List;
import java.util.UUID;
import org.springframework.data.repository.Repository;

/** Insert-and-read access to the timeline. No update or delete methods are exposed. */
public interface TimelineEntryRepository extends Repository<TimelineEntry, UUID> {

  TimelineEntry save(TimelineEntry entry);

  List<TimelineEntry> findByWorkOrderIdAndTenantIdOrderByOccurredAtAsc(
      UUID workOrderId, String tenantId);

  long countByWorkOrderId(UUID workOrderId);
}
