package com.scholary.stt.pipeline;

import java.nio.file.Path;

/**
 * A probed local audio file, fixed for the lifetime of one transcription.
 *
 * @param file local path to the source
 * @param durationSeconds probed duration
 * @param languageHint language passed to the engine
 */
public record AudioSource(Path file, double durationSeconds, String languageHint) {

  public AudioSource {
    if (file == null) {
      throw new IllegalArgumentException("File is required");
    }
    if (!(durationSeconds > 0)) {
      throw new IllegalArgumentException("Duration must be positive");
    }
  }
}
