package io.b2mash.b2b.fmcore.stats;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.fmcore.workorder.WorkOrderPriority;
import io.b2mash.b2b.fmcore.workorder.WorkOrderStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class WorkOrderStatsCalculatorTest {

  private static final Instant NOW = Instant.parse("2026-03-20T12:00:00Z");

  @Test
  void aggregates_mixed_portfolio() {
    var rows =
        List.of(
            open(WorkOrderStatus.REPORTED, hoursAgo(50), hoursAgo(26)),
            open(WorkOrderStatus.IN_PROGRESS, hoursAgo(10), NOW.plus(Duration.ofHours(14))),
            open(WorkOrderStatus.ON_HOLD, hoursAgo(5), NOW.plus(Duration.ofHours(19))),
            completed(hoursAgo(30), hoursAgo(20), hoursAgo(6)),
            completed(hoursAgo(100), hoursAgo(40), hoursAgo(76)));

    var stats = WorkOrderStatsCalculator.calculate(rows, NOW);

    assertThat(stats.total()).isEqualTo(5);
    assertThat(stats.statusCounts().values().stream().mapToLong(Long::longValue).sum())
        .isEqualTo(stats.total());
    assertThat(stats.statusCounts())
        .containsEntry("REPORTED", 1L)
        .containsEntry("COMPLETED", 2L)
        .containsEntry("CANCELLED", 0L);
    assertThat(stats.overdueCount()).isEqualTo(1);
    // (10h + 60h) / 2
    assertThat(stats.avgCompletionHours()).isEqualTo(35.0);
    assertThat(stats.slaComplianceRate()).isEqualTo(0.5);
    assertThat(stats.completedLast7Days()).isEqualTo(2);
  }

  @Test
  void empty_input_leaves_ratios_null() {
    var stats = WorkOrderStatsCalculator.calculate(List.of(), NOW);

    assertThat(stats.total()).isZero();
    assertThat(stats.overdueCount()).isZero();
    assertThat(stats.avgCompletionHours()).isNull();
    assertThat(stats.slaComplianceRate()).isNull();
    assertThat(stats.statusCounts()).hasSize(WorkOrderStatus.values().length).containsValue(0L);
    assertThat(stats.priorityCounts().keySet())
        .containsExactly("LOW", "MEDIUM", "HIGH", "CRITICAL");
  }

  @Test
  void terminal_work_past_deadline_is_not_overdue() {
    var cancelled =
        new WorkOrderStatsRow(
            WorkOrderStatus.CANCELLED, WorkOrderPriority.LOW, hoursAgo(200), null, hoursAgo(128));

    var stats = WorkOrderStatsCalculator.calculate(List.of(cancelled), NOW);

    assertThat(stats.overdueCount()).isZero();
    assertThat(stats.slaComplianceRate()).isNull();
  }

  @Test
  void compliance_ignores_completed_rows_without_deadline() {
    var rows =
        List.of(
            completed(hoursAgo(10), hoursAgo(5), null),
            completed(hoursAgo(10), hoursAgo(5), hoursAgo(4)));

    var stats = WorkOrderStatsCalculator.calculate(rows, NOW);

    assertThat(stats.slaComplianceRate()).isEqualTo(1.0);
    assertThat(stats.avgCompletionHours()).isEqualTo(5.0);
  }

  @Test
  void completion_recency_windows() {
    var rows =
        List.of(
            completed(hoursAgo(24 * 40), hoursAgo(24 * 3), null),
            completed(hoursAgo(24 * 40), hoursAgo(24 * 10), null),
            completed(hoursAgo(24 * 40), hoursAgo(24 * 35), null));

    var stats = WorkOrderStatsCalculator.calculate(rows, NOW);

    assertThat(stats.completedLast7Days()).isEqualTo(1);
    assertThat(stats.completedLast30Days()).isEqualTo(2);
  }

  private static Instant hoursAgo(long hours) {
    return NOW.minus(Duration.ofHours(hours));
  }

  private static WorkOrderStatsRow open(
      WorkOrderStatus status, Instant createdAt, Instant slaDueAt) {
    return new WorkOrderStatsRow(status, WorkOrderPriority.MEDIUM, createdAt, null, slaDueAt);
  }

  private static WorkOrderStatsRow completed(
      Instant createdAt, Instant completedAt, Instant slaDueAt) {
    return new WorkOrderStatsRow(
        WorkOrderStatus.COMPLETED, WorkOrderPriority.HIGH, createdAt, completedAt, slaDueAt);
  }
}
