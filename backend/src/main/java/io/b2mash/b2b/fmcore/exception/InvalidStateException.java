package io.b2mash.b2b.fmcore.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** A request that the work order's current state does not allow. Rendered as 400. */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(
        HttpStatus.BAD_REQUEST,
        Problems.of(HttpStatus.BAD_REQUEST, "invalid-state", title, detail),
        null);
  }
}
