package io.b2mash.b2b.fmcore.exception;

import java.util.Locale;
import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** Unknown ids and ids owned by another organization both end up here. */
public class ResourceNotFoundException extends ErrorResponseException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(
        HttpStatus.NOT_FOUND,
        Problems.of(
            HttpStatus.NOT_FOUND,
            "not-found",
            resourceType + " not found",
            "No " + resourceType.toLowerCase(Locale.ROOT) + " found with id " + id),
        null);
  }
}
