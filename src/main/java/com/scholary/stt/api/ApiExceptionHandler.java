package com.scholary.stt.api;

import com.scholary.stt.chunking.ChunkingConfigurationException;
import java.nio.file.InvalidPathException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps request and configuration errors to 400 responses, and a full job queue to 503. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ChunkingConfigurationException.class)
  public ResponseEntity<ApiError> handleConfiguration(ChunkingConfigurationException e) {
    LOGGER.warn("Rejected configuration: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ApiError.of("INVALID_CONFIGURATION", e.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException e) {
    String message =
        e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ApiError.of("INVALID_REQUEST", message));
  }

  @ExceptionHandler(InvalidPathException.class)
  public ResponseEntity<ApiError> handleInvalidPath(InvalidPathException e) {
    LOGGER.warn("Rejected file path: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ApiError.of("INVALID_FILE_PATH", e.getMessage()));
  }

  @ExceptionHandler(TaskRejectedException.class)
  public ResponseEntity<ApiError> handleRejected(TaskRejectedException e) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(ApiError.of("QUEUE_FULL", "Job queue is full, retry later"));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException e) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ApiError.of("INVALID_REQUEST", "Malformed request body"));
  }
}
