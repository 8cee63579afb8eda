package io.b2mash.b2b.fmcore.exception;

import java.net.URI;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/** Builds the RFC 7807 bodies of this service's errors. Problem types are {@code urn:fm:*}. */
final class Problems {

  static final String TYPE_PREFIX = "urn:fm:problem:";

  static ProblemDetail of(HttpStatus status, String type, String title, String detail) {
    var problem = ProblemDetail.forStatusAndDetail(status, detail);
    problem.setType(URI.create(TYPE_PREFIX + type));
    problem.setTitle(title);
    return problem;
  }

  private Problems() {}
}
