package io.b2mash.b2b.fmcore.assignment;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of an auto-assign call. "Disabled" and "no eligible candidates" are ordinary results
 * with {@code success=false}, not errors.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AutoAssignResult(
    boolean success, AssignmentCandidate assignee, String routingMode, String error) {

  public static final String DISABLED = "Auto-assignment is disabled";
  public static final String NO_CANDIDATES = "No eligible candidates";

  public static AutoAssignResult assigned(AssignmentCandidate assignee, String routingMode) {
    return new AutoAssignResult(true, assignee, routingMode, null);
  }

  public static AutoAssignResult failed(String error) {
    return new AutoAssignResult(false, null, null, error);
  }
}
