package io.b2mash.b2b.fmcore.stats;

import io.b2mash.b2b.fmcore.stats.dto.WorkOrderStats;
import io.b2mash.b2b.fmcore.workorder.WorkOrderPriority;
import io.b2mash.b2b.fmcore.workorder.WorkOrderStatus;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure KPI aggregation over work order rows. No Spring dependencies.
 *
 * <ul>
 *   <li>overdue: not COMPLETED or CANCELLED, and {@code slaDueAt < now}
 *   <li>average completion: mean of {@code completedAt - createdAt} over COMPLETED rows, in hours
 *   <li>SLA compliance: completed rows with a deadline where {@code completedAt <= slaDueAt}, over
 *       all completed rows with a deadline
 * </ul>
 */
public final class WorkOrderStatsCalculator {

  private static final double MILLIS_PER_HOUR = 3_600_000.0;

  private WorkOrderStatsCalculator() {}

  public static WorkOrderStats calculate(List<WorkOrderStatsRow> rows, Instant now) {
    Map<String, Long> statusCounts = new LinkedHashMap<>();
    for (WorkOrderStatus status : WorkOrderStatus.values()) {
      statusCounts.put(status.name(), 0L);
    }
    Map<String, Long> priorityCounts = new LinkedHashMap<>();
    for (WorkOrderPriority priority : WorkOrderPriority.values()) {
      priorityCounts.put(priority.name(), 0L);
    }

    long overdue = 0;
    long completedCount = 0;
    long completionMillis = 0;
    long slaDefined = 0;
    long slaMet = 0;
    long completedLast7Days = 0;
    long completedLast30Days = 0;
    Instant weekAgo = now.minus(Duration.ofDays(7));
    Instant monthAgo = now.minus(Duration.ofDays(30));

    for (WorkOrderStatsRow row : rows) {
      statusCounts.merge(row.status().name(), 1L, Long::sum);
      if (row.priority() != null) {
        priorityCounts.merge(row.priority().name(), 1L, Long::sum);
      }

      if (!row.status().isTerminal() && row.slaDueAt() != null && row.slaDueAt().isBefore(now)) {
        overdue++;
      }

      if (row.status() != WorkOrderStatus.COMPLETED || row.completedAt() == null) {
        continue;
      }
      completedCount++;
      completionMillis += Duration.between(row.createdAt(), row.completedAt()).toMillis();
      if (row.slaDueAt() != null) {
        slaDefined++;
        if (!row.completedAt().isAfter(row.slaDueAt())) {
          slaMet++;
        }
      }
      if (!row.completedAt().isBefore(weekAgo)) {
        completedLast7Days++;
      }
      if (!row.completedAt().isBefore(monthAgo)) {
        completedLast30Days++;
      }
    }

    Double avgCompletionHours =
        completedCount == 0
            ? null
            : round2(completionMillis / MILLIS_PER_HOUR / completedCount);
    Double slaComplianceRate = slaDefined == 0 ? null : (double) slaMet / slaDefined;

    return new WorkOrderStats(
        rows.size(),
        statusCounts,
        priorityCounts,
        overdue,
        avgCompletionHours,
        slaComplianceRate,
        completedLast7Days,
        completedLast30Days);
  }

  private static double round2(double value) {
    return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }
}
