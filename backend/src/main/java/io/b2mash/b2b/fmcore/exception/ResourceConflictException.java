package io.b2mash.b2b.fmcore.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** A write lost a version race. Callers reload and decide whether to retry. */
public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String title, String detail) {
    super(HttpStatus.CONFLICT, Problems.of(HttpStatus.CONFLICT, "conflict", title, detail), null);
  }
}
