package com.scholary.stt.chunking;

/**
 * A single planned slice of the source audio, in seconds.
 *
 * <p>Windows are ordered by {@code index}; consecutive windows share the configured overlap.
 */
public record ChunkWindow(int index, double start, double end) {

  public ChunkWindow {
    if (index < 0) {
      throw new IllegalArgumentException("Index cannot be negative");
    }
    if (start < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (end <= start) {
      throw new IllegalArgumentException("End time must be > start time");
    }
  }

  public double duration() {
    return end - start;
  }
}
