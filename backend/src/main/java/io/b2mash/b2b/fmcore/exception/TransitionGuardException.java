package io.b2mash.b2b.fmcore.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a transition edge exists but one of its preconditions is unmet. The {@code required}
 * problem property names the missing precondition (an attachment category or {@code ASSIGNMENT})
 * so clients can prompt for it without parsing the detail text.
 */
public class TransitionGuardException extends ErrorResponseException {

  private final String required;

  public TransitionGuardException(String required, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(required, detail), null);
    this.required = required;
  }

  public String getRequired() {
    return required;
  }

  private static ProblemDetail createProblem(String required, String detail) {
    var problem =
        Problems.of(
            HttpStatus.BAD_REQUEST, "transition-guard", "Transition precondition not met", detail);
    problem.setProperty("required", required);
    return problem;
  }
}
