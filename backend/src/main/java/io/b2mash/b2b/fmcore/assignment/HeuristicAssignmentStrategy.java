package io.b2mash.b2b.fmcore.assignment;

import io.b2mash.b2b.fmcore.workorder.WorkOrder;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Ranks the tenant's non-offline technicians and vendors by {@link CandidateScorer}. Candidates
 * must share at least one skill with the work order when it requires any. Ties go to the lower
 * current workload, then to the lexicographically smaller id.
 */
@Component
public class HeuristicAssignmentStrategy implements AssignmentStrategy {

  public static final String NAME = "heuristic";

  static final Comparator<AssignmentCandidate> RANKING =
      Comparator.comparingDouble(AssignmentCandidate::score)
          .reversed()
          .thenComparingInt(AssignmentCandidate::currentWorkload)
          .thenComparing(AssignmentCandidate::id);

  private static final Logger log = LoggerFactory.getLogger(HeuristicAssignmentStrategy.class);

  private final AssigneeRepository assigneeRepository;
  private final CandidateScorer candidateScorer;

  public HeuristicAssignmentStrategy(
      AssigneeRepository assigneeRepository, CandidateScorer candidateScorer) {
    this.assigneeRepository = assigneeRepository;
    this.candidateScorer = candidateScorer;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<AssignmentCandidate> rank(WorkOrder workOrder) {
    var requiredSkills = workOrder.getRequiredSkills();
    var ranked =
        assigneeRepository
            .findByTenantIdAndAvailabilityNot(workOrder.getTenantId(), Availability.OFFLINE)
            .stream()
            .filter(a -> a.getAvailability() != Availability.OFFLINE)
            .filter(
                a ->
                    requiredSkills.isEmpty()
                        || CandidateScorer.matchedSkills(requiredSkills, a.getSkills()) > 0)
            .map(a -> candidateScorer.score(a, requiredSkills))
            .sorted(RANKING)
            .toList();

    if (log.isDebugEnabled()) {
      ranked.forEach(
          c ->
              log.debug(
                  "Work order {} candidate {} score={} reasons={}",
                  workOrder.getId(),
                  c.id(),
                  c.score(),
                  c.reasons()));
    }
    return ranked;
  }
}
