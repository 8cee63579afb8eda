package io.b2mash.b2b.fmcore.assignment;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Scores one assignee against a work order's required skills:
 *
 * <pre>
 * score = skill        * matchedSkills / requiredSkills   (1.0 when nothing is required)
 *       + availability * (AVAILABLE 1.0, BUSY 0.3)
 *       + capacity     * clamp(1 - currentWorkload / maxWorkload, 0, 1)   (0 when max is 0)
 *       + rating       * rating / 5                       (0 when unrated)
 * </pre>
 */
@Component
public class CandidateScorer {

  static final double BUSY_BONUS = 0.3;
  static final double MAX_RATING = 5.0;

  private final AssignmentWeights weights;

  public CandidateScorer(AssignmentWeights weights) {
    this.weights = weights;
  }

  /** Number of required skills the assignee has. Skill tags compare case-insensitively. */
  public static int matchedSkills(Collection<String> requiredSkills, Collection<String> skills) {
    Set<String> owned = normalize(skills);
    return (int) normalize(requiredSkills).stream().filter(owned::contains).count();
  }

  public AssignmentCandidate score(Assignee assignee, List<String> requiredSkills) {
    if (assignee.getAvailability() == Availability.OFFLINE) {
      throw new IllegalArgumentException("Offline assignee " + assignee.getId() + " is not scored");
    }
    var reasons = new ArrayList<String>();

    int required = normalize(requiredSkills).size();
    double skillRatio;
    if (required == 0) {
      skillRatio = 1.0;
      reasons.add("No specific skills required");
    } else {
      int matched = matchedSkills(requiredSkills, assignee.getSkills());
      skillRatio = (double) matched / required;
      reasons.add("Skill match: " + matched + "/" + required);
    }

    double availabilityBonus;
    if (assignee.getAvailability() == Availability.AVAILABLE) {
      availabilityBonus = 1.0;
      reasons.add("Available");
    } else {
      availabilityBonus = BUSY_BONUS;
      reasons.add("Busy");
    }

    double spareCapacity = spareCapacity(assignee.getCurrentWorkload(), assignee.getMaxWorkload());
    reasons.add("Spare capacity: " + Math.round(spareCapacity * 100) + "%");

    double ratingNormalized = 0.0;
    BigDecimal rating = assignee.getRating();
    if (rating != null) {
      ratingNormalized = Math.max(0.0, Math.min(1.0, rating.doubleValue() / MAX_RATING));
      reasons.add(String.format(Locale.ROOT, "Rating: %.1f/5", rating.doubleValue()));
    }

    double score =
        weights.skill() * skillRatio
            + weights.availability() * availabilityBonus
            + weights.capacity() * spareCapacity
            + weights.rating() * ratingNormalized;

    return new AssignmentCandidate(
        assignee.getId(),
        assignee.getType(),
        assignee.getName(),
        assignee.getSkills(),
        assignee.getAvailability(),
        assignee.getCurrentWorkload(),
        assignee.getMaxWorkload(),
        score,
        reasons);
  }

  static double spareCapacity(int currentWorkload, int maxWorkload) {
    if (maxWorkload <= 0) {
      return 0.0;
    }
    double spare = 1.0 - (double) currentWorkload / maxWorkload;
    return Math.max(0.0, Math.min(1.0, spare));
  }

  private static Set<String> normalize(Collection<String> skills) {
    if (skills == null) {
      return Set.of();
    }
    return skills.stream()
        .filter(s -> s != null && !s.isBlank())
        .map(s -> s.trim().toLowerCase(Locale.ROOT))
        .collect(Collectors.toSet());
  }
}
