package com.scholary.stt.pipeline;

import com.scholary.stt.chunking.ChunkingConfigurationException;
import com.scholary.stt.chunking.OverlapChunkPlanner;

/**
 * Per-request pipeline settings.
 *
 * @param chunkLengthSeconds nominal chunk length
 * @param overlapSeconds seconds shared by consecutive chunks
 * @param baseTimeoutSeconds minimum operation deadline
 * @param timeoutMultiplier deadline seconds per second of audio
 * @param maxThreads engine threads, 0 for auto
 */
public record PipelineConfig(
    double chunkLengthSeconds,
    double overlapSeconds,
    double baseTimeoutSeconds,
    double timeoutMultiplier,
    int maxThreads) {

  public static final double DEFAULT_CHUNK_LENGTH_SECONDS = 30.0;
  public static final double DEFAULT_OVERLAP_SECONDS = 1.0;
  public static final double DEFAULT_BASE_TIMEOUT_SECONDS = 90.0;
  public static final double DEFAULT_TIMEOUT_MULTIPLIER = 1.5;

  public static PipelineConfig defaults() {
    return new PipelineConfig(
        DEFAULT_CHUNK_LENGTH_SECONDS,
        DEFAULT_OVERLAP_SECONDS,
        DEFAULT_BASE_TIMEOUT_SECONDS,
        DEFAULT_TIMEOUT_MULTIPLIER,
        0);
  }

  /**
   * Reject inconsistent settings before any work starts.
   *
   * @throws ChunkingConfigurationException on the first invalid value
   */
  public void validate() {
    OverlapChunkPlanner.validate(chunkLengthSeconds, overlapSeconds);
    if (!(baseTimeoutSeconds > 0)) {
      throw new ChunkingConfigurationException(
          "Base timeout must be positive, got " + baseTimeoutSeconds);
    }
    if (!(timeoutMultiplier > 0)) {
      throw new ChunkingConfigurationException(
          "Timeout multiplier must be positive, got " + timeoutMultiplier);
    }
    if (maxThreads < 0) {
      throw new ChunkingConfigurationException("Max threads cannot be negative, got " + maxThreads);
    }
  }

  /** Copy with any non-null override applied. */
  public PipelineConfig withOverrides(
      Double chunkLength, Double overlap, Double baseTimeout, Double multiplier, Integer threads) {
    return new PipelineConfig(
        chunkLength != null ? chunkLength : chunkLengthSeconds,
        overlap != null ? overlap : overlapSeconds,
        baseTimeout != null ? baseTimeout : baseTimeoutSeconds,
        multiplier != null ? multiplier : timeoutMultiplier,
        threads != null ? threads : maxThreads);
  }
}
