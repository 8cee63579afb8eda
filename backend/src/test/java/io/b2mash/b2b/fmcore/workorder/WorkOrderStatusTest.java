package io.b2mash.b2b.fmcore.workorder;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class WorkOrderStatusTest {

  @Test
  void reported_allows_assessment_hold_and_cancel() {
    assertThat(WorkOrderStatus.REPORTED.allowedTransitions())
        .containsExactlyInAnyOrder(
            WorkOrderStatus.ASSESSMENT, WorkOrderStatus.ON_HOLD, WorkOrderStatus.CANCELLED);
  }

  @Test
  void in_progress_allows_completion_hold_and_cancel() {
    assertThat(WorkOrderStatus.IN_PROGRESS.allowedTransitions())
        .containsExactlyInAnyOrder(
            WorkOrderStatus.COMPLETED, WorkOrderStatus.ON_HOLD, WorkOrderStatus.CANCELLED);
  }

  @Test
  void terminal_statuses_have_no_outgoing_edges() {
    assertThat(WorkOrderStatus.COMPLETED.allowedTransitions()).isEmpty();
    assertThat(WorkOrderStatus.CANCELLED.allowedTransitions()).isEmpty();
  }

  @Test
  void every_non_terminal_status_can_be_cancelled() {
    for (WorkOrderStatus status : WorkOrderStatus.values()) {
      if (!status.isTerminal()) {
        assertThat(status.allowedTransitions()).contains(WorkOrderStatus.CANCELLED);
      }
    }
  }

  @Test
  void no_edge_skips_a_workflow_step() {
    assertThat(WorkOrderStatus.REPORTED.allowedTransitions())
        .doesNotContain(WorkOrderStatus.APPROVED, WorkOrderStatus.IN_PROGRESS);
    assertThat(WorkOrderStatus.APPROVED.allowedTransitions())
        .doesNotContain(WorkOrderStatus.COMPLETED);
  }

  @Test
  void only_completed_and_cancelled_are_terminal() {
    assertThat(WorkOrderStatus.COMPLETED.isTerminal()).isTrue();
    assertThat(WorkOrderStatus.CANCELLED.isTerminal()).isTrue();
    assertThat(WorkOrderStatus.ON_HOLD.isTerminal()).isFalse();
    assertThat(WorkOrderStatus.IN_PROGRESS.isTerminal()).isFalse();
  }
}
