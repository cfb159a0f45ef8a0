package com.scholary.songgen.api;

import com.scholary.songgen.job.JobNotFoundException;
import com.scholary.songgen.lyrics.LyricsProviderException;
import com.scholary.songgen.lyrics.UnknownProviderException;
import com.scholary.songgen.service.ArtifactNotFoundException;
import com.scholary.songgen.service.InvalidSubmissionException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps exceptions to {@code {"error": "..."}} responses. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({JobNotFoundException.class, ArtifactNotFoundException.class})
  public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException e) {
    return error(HttpStatus.NOT_FOUND, e.getMessage());
  }

  @ExceptionHandler({InvalidSubmissionException.class, UnknownProviderException.class})
  public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException e) {
    LOGGER.info("Rejected request: {}", e.getMessage());
    return error(HttpStatus.BAD_REQUEST, e.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
    String message =
        e.getBindingResult().getFieldErrors().stream()
            .map(fieldError -> fieldError.getField() + " " + fieldError.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return error(HttpStatus.BAD_REQUEST, "Invalid request: " + message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
    return error(HttpStatus.BAD_REQUEST, "Malformed request body");
  }

  @ExceptionHandler(LyricsProviderException.class)
  public ResponseEntity<ErrorResponse> handleProvider(LyricsProviderException e) {
    LOGGER.warn("Lyrics provider failure: {}", e.getMessage());
    return error(HttpStatus.BAD_GATEWAY, e.getMessage());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
    LOGGER.error("Unhandled request failure", e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error: " + e.getMessage());
  }

  private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
    return ResponseEntity.status(status).body(new ErrorResponse(message));
  }
}
