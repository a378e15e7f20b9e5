package com.scholary.stt.chunking;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Plans fixed-length chunk windows with overlap.
 *
 * <p>Audio that fits in one chunk is returned as a single window covering the whole clip. Longer
 * audio is cut iteratively: each window ends {@code chunkLength} seconds after it starts (clamped
 * to the clip end) and the next one starts {@code overlap} seconds before that end.
 *
 * <p>The planner is pure. Identical arguments always produce identical windows.
 */
@Component
public class OverlapChunkPlanner {

  private static final Logger LOGGER = LoggerFactory.getLogger(OverlapChunkPlanner.class);

  /**
   * Plan chunk windows for a clip.
   *
   * @param durationSeconds total clip duration
   * @param chunkLengthSeconds nominal window length
   * @param overlapSeconds seconds shared by consecutive windows
   * @return windows ordered by index and start time
   * @throws ChunkingConfigurationException if the arguments are inconsistent
   */
  public List<ChunkWindow> plan(
      double durationSeconds, double chunkLengthSeconds, double overlapSeconds) {
    validate(chunkLengthSeconds, overlapSeconds);
    if (!(durationSeconds > 0) || Double.isInfinite(durationSeconds)) {
      throw new ChunkingConfigurationException(
          String.format("Duration must be positive, got %ss", durationSeconds));
    }

    if (durationSeconds <= chunkLengthSeconds) {
      return List.of(new ChunkWindow(0, 0.0, durationSeconds));
    }

    List<ChunkWindow> windows = new ArrayList<>();
    double start = 0.0;
    double end = 0.0;
    while (end < durationSeconds) {
      end = Math.min(start + chunkLengthSeconds, durationSeconds);
      windows.add(new ChunkWindow(windows.size(), start, end));
      start = end - overlapSeconds;
    }

    LOGGER.debug(
        "Planned {} windows for {}s (chunk={}s, overlap={}s)",
        windows.size(),
        durationSeconds,
        chunkLengthSeconds,
        overlapSeconds);
    return windows;
  }

  /**
   * Check the chunk/overlap relationship without planning anything.
   *
   * @throws ChunkingConfigurationException if the chunk length or overlap is invalid
   */
  public static void validate(double chunkLengthSeconds, double overlapSeconds) {
    if (!(chunkLengthSeconds > 0) || Double.isInfinite(chunkLengthSeconds)) {
      throw new ChunkingConfigurationException(
          String.format("Chunk length must be positive, got %ss", chunkLengthSeconds));
    }
    if (!(overlapSeconds >= 0)) {
      throw new ChunkingConfigurationException(
          String.format("Overlap cannot be negative, got %ss", overlapSeconds));
    }
    if (overlapSeconds >= chunkLengthSeconds) {
      throw new ChunkingConfigurationException(
          String.format(
              "Overlap (%ss) must be less than chunk duration (%ss)",
              overlapSeconds, chunkLengthSeconds));
    }
  }
}
