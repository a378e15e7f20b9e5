package com.scholary.stt.chunking;

/**
 * Computes the operation-wide deadline for a transcription.
 *
 * <p>Long clips get a deadline proportional to their duration; short ones get the configured
 * floor.
 */
public final class AdaptiveTimeout {

  private AdaptiveTimeout() {}

  /**
   * @param durationSeconds clip duration
   * @param baseTimeoutSeconds minimum deadline
   * @param multiplier seconds of budget per second of audio
   * @return {@code max(baseTimeoutSeconds, durationSeconds * multiplier)}
   */
  public static double compute(
      double durationSeconds, double baseTimeoutSeconds, double multiplier) {
    if (!(durationSeconds >= 0)) {
      throw new ChunkingConfigurationException("Duration cannot be negative: " + durationSeconds);
    }
    if (!(baseTimeoutSeconds > 0)) {
      throw new ChunkingConfigurationException(
          "Base timeout must be positive: " + baseTimeoutSeconds);
    }
    if (!(multiplier > 0)) {
      throw new ChunkingConfigurationException("Timeout multiplier must be positive: " + multiplier);
    }
    return Math.max(baseTimeoutSeconds, durationSeconds * multiplier);
  }
}
