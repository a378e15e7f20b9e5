package com.scholary.stt.api;

import java.time.Instant;

/** Error body for rejected requests. */
public record ApiError(String errorCode, String message, Instant timestamp) {

  public static ApiError of(String errorCode, String message) {
    return new ApiError(errorCode, message, Instant.now());
  }
}
