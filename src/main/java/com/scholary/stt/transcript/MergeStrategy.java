package com.scholary.stt.transcript;

import java.util.List;

/**
 * Strategy for joining per-chunk texts into one transcript.
 *
 * <p>Implementations receive only successful chunks, already sorted by index and cleaned.
 */
public interface MergeStrategy {

  /**
   * @param orderedTexts chunk texts in playback order, none blank
   * @return the joined transcript
   */
  String merge(List<String> orderedTexts);

  /** Strategy name for logging. */
  String getStrategyName();
}
