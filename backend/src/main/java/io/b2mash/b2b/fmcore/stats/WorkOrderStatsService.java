package io.b2mash.b2b.fmcore.stats;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.b2b.fmcore.actor.ActorContext;
import io.b2mash.b2b.fmcore.exception.InvalidStateException;
import io.b2mash.b2b.fmcore.stats.dto.WorkOrderStats;
import io.b2mash.b2b.fmcore.workorder.WorkOrderAccessService;
import io.b2mash.b2b.fmcore.workorder.WorkOrderAction;
import io.b2mash.b2b.fmcore.workorder.WorkOrderRepository;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Work order KPIs for the dashboard, optionally limited to work orders created in {@code [from,
 * to)}. Results are cached per tenant and window for {@link StatsProperties#cacheTtl()}.
 */
@Service
public class WorkOrderStatsService {

  static final Instant OPEN_START = Instant.EPOCH;
  static final Instant OPEN_END = Instant.parse("9999-12-31T00:00:00Z");

  private static final Logger log = LoggerFactory.getLogger(WorkOrderStatsService.class);

  private final WorkOrderAccessService accessService;
  private final WorkOrderRepository workOrderRepository;
  private final Clock clock;
  private final Cache<StatsKey, WorkOrderStats> cache;

  public WorkOrderStatsService(
      WorkOrderAccessService accessService,
      WorkOrderRepository workOrderRepository,
      StatsProperties properties,
      Clock clock) {
    this.accessService = accessService;
    this.workOrderRepository = workOrderRepository;
    this.clock = clock;
    this.cache =
        Caffeine.newBuilder().maximumSize(1_000).expireAfterWrite(properties.cacheTtl()).build();
  }

  @Transactional(readOnly = true)
  public WorkOrderStats getStats(ActorContext actor, Instant from, Instant to) {
    var scope = accessService.requireTenantAbility(actor, WorkOrderAction.VIEW_STATS);
    Instant windowStart = from != null ? from : OPEN_START;
    Instant windowEnd = to != null ? to : OPEN_END;
    if (!windowStart.isBefore(windowEnd)) {
      throw new InvalidStateException(
          "Invalid stats window", "from (" + from + ") must be before to (" + to + ")");
    }

    var key = new StatsKey(scope.tenantId(), windowStart, windowEnd);
    return cache.get(key, this::compute);
  }

  private WorkOrderStats compute(StatsKey key) {
    var rows =
        key.tenantId() != null
            ? workOrderRepository.findStatsRows(key.tenantId(), key.from(), key.to())
            : workOrderRepository.findStatsRowsAcrossTenants(key.from(), key.to());
    log.debug(
        "Computing work order stats for tenant={} over {} rows", key.tenantId(), rows.size());
    return WorkOrderStatsCalculator.calculate(rows, Instant.now(clock));
  }

  private record StatsKey(String tenantId, Instant from, Instant to) {}
}
