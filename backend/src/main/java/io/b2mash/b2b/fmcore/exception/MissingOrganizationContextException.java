package io.b2mash.b2b.fmcore.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class MissingOrganizationContextException extends ErrorResponseException {

  public MissingOrganizationContextException() {
    super(
        HttpStatus.UNAUTHORIZED,
        Problems.of(
            HttpStatus.UNAUTHORIZED,
            "missing-organization",
            "Missing organization context",
            "Request does not carry an organization or a recognised role"),
        null);
  }
}
