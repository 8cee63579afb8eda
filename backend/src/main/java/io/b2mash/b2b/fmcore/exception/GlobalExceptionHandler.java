package io.b2mash.b2b.fmcore.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(ForbiddenException.class)
  public ResponseEntity<ProblemDetail> handleForbidden(
      ForbiddenException ex, HttpServletRequest request) {
    log.warn(
        "Forbidden: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getBody().getDetail());
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ex.getBody());
  }

  @ExceptionHandler(ResourceConflictException.class)
  public ResponseEntity<ProblemDetail> handleConflict(
      ResourceConflictException ex, HttpServletRequest request) {
    log.warn(
        "Conflict: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getBody().getDetail());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(ex.getBody());
  }

  @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handleOptimisticLock(
      ObjectOptimisticLockingFailureException ex) {
    log.warn("Optimistic locking failure: {}", ex.getMessage());
    var problem =
        Problems.of(
            HttpStatus.CONFLICT,
            "conflict",
            "Concurrent modification",
            "Resource was modified concurrently. Reload and retry.");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }
}
