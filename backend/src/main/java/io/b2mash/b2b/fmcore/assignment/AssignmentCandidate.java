package io.b2mash.b2b.fmcore.assignment;

import java.util.List;

/**
 * A scored assignee for one auto-assign run. {@code reasons} explains the score to operators and
 * plays no part in ranking.
 */
public record AssignmentCandidate(
    String id,
    AssigneeType type,
    String name,
    List<String> skills,
    Availability availability,
    int currentWorkload,
    int maxWorkload,
    double score,
    List<String> reasons) {

  public AssignmentCandidate {
    skills = List.copyOf(skills);
    reasons = List.copyOf(reasons);
  }
}
