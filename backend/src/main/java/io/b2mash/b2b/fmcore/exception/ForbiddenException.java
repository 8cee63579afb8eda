package io.b2mash.b2b.fmcore.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** The caller is known but may not act here: a denied ability or a foreign organization. */
public class ForbiddenException extends ErrorResponseException {

  public ForbiddenException(String title, String detail) {
    super(
        HttpStatus.FORBIDDEN, Problems.of(HttpStatus.FORBIDDEN, "forbidden", title, detail), null);
  }
}
