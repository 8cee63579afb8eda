package io.b2mash.b2b.fmcore.assignment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.fmcore.workorder.TestWorkOrders;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HeuristicAssignmentStrategyTest {

  private static final String TENANT = "org_acme";

  @Mock private AssigneeRepository assigneeRepository;

  private HeuristicAssignmentStrategy strategy;

  @BeforeEach
  void setUp() {
    strategy =
        new HeuristicAssignmentStrategy(
            assigneeRepository, new CandidateScorer(AssignmentWeights.DEFAULTS));
  }

  @Test
  void offline_candidate_is_never_ranked_even_when_best_on_paper() {
    pool(
        TestAssignees.technician(
            "tech_offline", TENANT, List.of("plumbing"), Availability.OFFLINE, 0, 5, "5.0"),
        TestAssignees.technician(
            "tech_busy", TENANT, List.of("plumbing"), Availability.BUSY, 4, 5, "2.0"));

    var ranked = strategy.rank(TestWorkOrders.reported(TENANT, "plumbing"));

    assertThat(ranked).extracting(AssignmentCandidate::id).containsExactly("tech_busy");
  }

  @Test
  void higher_score_ranks_first() {
    pool(
        TestAssignees.technician(
            "tech_busy", TENANT, List.of("plumbing"), Availability.BUSY, 1, 5, "4.0"),
        TestAssignees.technician(
            "tech_free", TENANT, List.of("plumbing"), Availability.AVAILABLE, 1, 5, "4.0"));

    var ranked = strategy.rank(TestWorkOrders.reported(TENANT, "plumbing"));

    assertThat(ranked)
        .extracting(AssignmentCandidate::id)
        .containsExactly("tech_free", "tech_busy");
  }

  @Test
  void equal_scores_go_to_lower_workload() {
    pool(
        TestAssignees.technician(
            "tech_a", TENANT, List.of("plumbing"), Availability.AVAILABLE, 3, 6, "4.0"),
        TestAssignees.technician(
            "tech_b", TENANT, List.of("plumbing"), Availability.AVAILABLE, 2, 4, "4.0"));

    var ranked = strategy.rank(TestWorkOrders.reported(TENANT, "plumbing"));

    assertThat(ranked.get(0).score()).isEqualTo(ranked.get(1).score());
    assertThat(ranked).extracting(AssignmentCandidate::id).containsExactly("tech_b", "tech_a");
  }

  @Test
  void equal_score_and_workload_go_to_smaller_id() {
    pool(
        TestAssignees.technician(
            "tech_b", TENANT, List.of("plumbing"), Availability.AVAILABLE, 1, 4, "4.0"),
        TestAssignees.technician(
            "tech_a", TENANT, List.of("plumbing"), Availability.AVAILABLE, 1, 4, "4.0"));

    var ranked = strategy.rank(TestWorkOrders.reported(TENANT, "plumbing"));

    assertThat(ranked).extracting(AssignmentCandidate::id).containsExactly("tech_a", "tech_b");
  }

  @Test
  void candidates_without_any_required_skill_are_excluded() {
    pool(
        TestAssignees.technician(
            "tech_sparky", TENANT, List.of("electrical"), Availability.AVAILABLE, 0, 5, "5.0"));

    assertThat(strategy.rank(TestWorkOrders.reported(TENANT, "plumbing"))).isEmpty();
  }

  @Test
  void work_without_skill_requirements_admits_everyone_online() {
    pool(
        TestAssignees.technician(
            "tech_sparky", TENANT, List.of("electrical"), Availability.AVAILABLE, 0, 5, null),
        TestAssignees.vendor("vendor_plumbco", TENANT, Availability.BUSY));

    var ranked = strategy.rank(TestWorkOrders.reported(TENANT));

    assertThat(ranked)
        .extracting(AssignmentCandidate::id)
        .containsExactlyInAnyOrder("tech_sparky", "vendor_plumbco");
  }

  private void pool(Assignee... assignees) {
    when(assigneeRepository.findByTenantIdAndAvailabilityNot(TENANT, Availability.OFFLINE))
        .thenReturn(List.of(assignees));
  }
}
