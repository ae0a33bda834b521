package com.scholary.narrator.api;

import com.scholary.narrator.extraction.UnsupportedDocumentException;
import com.scholary.narrator.job.IllegalJobTransitionException;
import com.scholary.narrator.job.JobNotCompleteException;
import com.scholary.narrator.job.JobNotFoundException;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Converts exceptions to HTTP responses at the REST boundary.
 *
 * <p>Pipeline failures never reach here; they are recorded on the job and reported by the status
 * endpoint.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(UnsupportedDocumentException.class)
  public ResponseEntity<ApiError> handleUnsupportedDocument(UnsupportedDocumentException ex) {
    LOGGER.warn("Rejected upload: {}", ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, ex, "Invalid upload", ex.getMessage());
  }

  @ExceptionHandler({
    MissingServletRequestPartException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ApiError> handleMissingPart(Exception ex) {
    return error(HttpStatus.BAD_REQUEST, ex, "Invalid upload", ex.getMessage());
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
    LOGGER.warn("Upload too large: {}", ex.getMessage());
    return error(
        HttpStatus.PAYLOAD_TOO_LARGE, ex, "File too large", "Maximum upload size is 50MB");
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ApiError> handleJobNotFound(JobNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ex, "Job not found", ex.getMessage());
  }

  @ExceptionHandler(JobNotCompleteException.class)
  public ResponseEntity<ApiError> handleJobNotComplete(JobNotCompleteException ex) {
    return error(HttpStatus.CONFLICT, ex, "Job not complete", ex.getMessage());
  }

  @ExceptionHandler(IllegalJobTransitionException.class)
  public ResponseEntity<ApiError> handleIllegalTransition(IllegalJobTransitionException ex) {
    return error(HttpStatus.CONFLICT, ex, "Job already finished", ex.getMessage());
  }

  @ExceptionHandler(TaskRejectedException.class)
  public ResponseEntity<ApiError> handleRejected(TaskRejectedException ex) {
    LOGGER.warn("Conversion rejected: {}", ex.getMessage());
    return error(
        HttpStatus.SERVICE_UNAVAILABLE,
        ex,
        "Server busy",
        "Too many conversions in progress, retry later");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
    LOGGER.error("Unexpected error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Check the server logs",
                Instant.now()));
  }

  private static ResponseEntity<ApiError> error(
      HttpStatus status, Exception ex, String message, String details) {
    return ResponseEntity.status(status)
        .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
  }
}
