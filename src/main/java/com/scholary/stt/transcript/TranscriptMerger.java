package com.scholary.stt.transcript;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines per-chunk results into the final transcript.
 *
 * <p>Failed chunks are omitted silently; the caller reports them through the outcome status and
 * counts. Confidence is the arithmetic mean over successful chunks, or 0.0 if there are none.
 */
public class TranscriptMerger {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptMerger.class);

  private final MergeStrategy strategy;

  public TranscriptMerger(MergeStrategy strategy) {
    this.strategy = strategy;
  }

  public MergedTranscript merge(List<ChunkResult> results) {
    List<ChunkResult> ok =
        results.stream()
            .filter(ChunkResult::isOk)
            .sorted(Comparator.comparingInt(ChunkResult::index))
            .collect(Collectors.toList());
    if (ok.isEmpty()) {
      return MergedTranscript.empty();
    }

    double confidence = ok.stream().mapToDouble(ChunkResult::confidence).average().orElse(0.0);
    List<String> texts =
        ok.stream()
            .map(result -> TextNormalizer.clean(result.text()))
            .filter(text -> !text.isEmpty())
            .collect(Collectors.toList());
    String text = strategy.merge(texts);

    LOGGER.debug(
        "Merged {} of {} chunks with {}: chars={}, confidence={}",
        ok.size(),
        results.size(),
        strategy.getStrategyName(),
        text.length(),
        confidence);
    return new MergedTranscript(text, confidence);
  }

  public String getStrategyName() {
    return strategy.getStrategyName();
  }
}
