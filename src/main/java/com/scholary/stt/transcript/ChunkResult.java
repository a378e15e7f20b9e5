package com.scholary.stt.transcript;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.stt.chunking.ChunkWindow;

/**
 * Result of transcribing one chunk window.
 *
 * <p>Exactly one result exists per planned window. The window bounds are kept so callers can tell
 * which time range of the source a failed chunk covers. Failed chunks carry an empty text and the
 * error that caused them to be skipped.
 *
 * @param index window index
 * @param start window start in seconds
 * @param end window end in seconds
 * @param text recognized text, empty when failed
 * @param confidence engine confidence, 0.0 when failed
 * @param status OK or FAILED
 * @param error failure reason, null when OK
 */
public record ChunkResult(
    int index,
    double start,
    double end,
    String text,
    double confidence,
    ChunkStatus status,
    String error) {

  public enum ChunkStatus {
    OK,
    FAILED
  }

  public static ChunkResult ok(ChunkWindow window, String text, double confidence) {
    return new ChunkResult(
        window.index(),
        window.start(),
        window.end(),
        text == null ? "" : text,
        confidence,
        ChunkStatus.OK,
        null);
  }

  public static ChunkResult failed(ChunkWindow window, String error) {
    return new ChunkResult(
        window.index(), window.start(), window.end(), "", 0.0, ChunkStatus.FAILED, error);
  }

  @JsonProperty("duration")
  public double duration() {
    return end - start;
  }

  @JsonIgnore
  public boolean isOk() {
    return status == ChunkStatus.OK;
  }
}
