package com.scholary.stt.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request to transcribe a local audio file.
 *
 * <p>Unset numeric fields fall back to the configured defaults.
 */
public record TranscriptionRequest(
    @NotBlank String filePath,
    String language,
    @Positive Double chunkLengthSeconds,
    @PositiveOrZero Double overlapSeconds,
    @Positive Double baseTimeoutSeconds,
    @Positive Double timeoutMultiplier,
    @PositiveOrZero Integer maxThreads) {

  public static TranscriptionRequest of(String filePath, String language) {
    return new TranscriptionRequest(filePath, language, null, null, null, null, null);
  }
}
