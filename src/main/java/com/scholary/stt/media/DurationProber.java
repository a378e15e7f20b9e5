package com.scholary.stt.media;

import java.nio.file.Path;

/** Determines the total duration of a local audio file. */
public interface DurationProber {

  /**
   * @param file local audio file
   * @return duration in seconds, always positive
   * @throws ProbeException if the file is unusable or its duration cannot be read
   */
  double probe(Path file);
}
