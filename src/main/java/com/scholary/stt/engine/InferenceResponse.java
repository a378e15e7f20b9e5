package com.scholary.stt.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Verbose JSON body returned by a whisper HTTP server.
 *
 * <p>Only the fields needed for text and confidence are mapped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record InferenceResponse(
    String text, String language, List<Segment> segments, Double confidence, String error) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Segment(String text, @JsonProperty("avg_logprob") Double avgLogprob) {}

  String resolvedText() {
    if (text != null) {
      return text.trim();
    }
    if (segments == null) {
      return "";
    }
    StringBuilder sb = new StringBuilder();
    for (Segment segment : segments) {
      if (segment.text() != null && !segment.text().isBlank()) {
        if (sb.length() > 0) {
          sb.append(' ');
        }
        sb.append(segment.text().trim());
      }
    }
    return sb.toString();
  }

  /** Top-level score when present, else the mean of per-segment probabilities, else 0. */
  double resolvedConfidence() {
    if (confidence != null) {
      return Math.max(0.0, Math.min(1.0, confidence));
    }
    if (segments == null) {
      return 0.0;
    }
    double sum = 0.0;
    int count = 0;
    for (Segment segment : segments) {
      if (segment.avgLogprob() != null) {
        sum += Math.min(1.0, Math.exp(segment.avgLogprob()));
        count++;
      }
    }
    return count > 0 ? sum / count : 0.0;
  }
}
