package com.scholary.stt.transcript;

import com.scholary.stt.transcript.LongestMatchFinder.MatchResult;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes words duplicated by the audio overlap between consecutive chunks.
 *
 * <p>The tail of the text merged so far is compared with the head of the next chunk. When a long
 * enough run ending the tail also appears in the head, the next chunk's words up to the end of
 * that run are dropped and the previous chunk's version is kept. Without a match the texts are
 * simply concatenated.
 */
public class WordOverlapMerger implements MergeStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(WordOverlapMerger.class);

  private final int contextWindowWords;
  private final int minMatchWords;

  public WordOverlapMerger(int contextWindowWords, int minMatchWords) {
    if (contextWindowWords < 1 || minMatchWords < 1) {
      throw new IllegalArgumentException("Window and minimum match must be >= 1");
    }
    this.contextWindowWords = contextWindowWords;
    this.minMatchWords = minMatchWords;
  }

  @Override
  public String merge(List<String> orderedTexts) {
    List<String> merged = new ArrayList<>();
    for (int i = 0; i < orderedTexts.size(); i++) {
      List<String> next = LongestMatchFinder.extractWords(orderedTexts.get(i));
      if (merged.isEmpty()) {
        merged.addAll(next);
        continue;
      }

      List<String> tail = merged.subList(Math.max(0, merged.size() - contextWindowWords), merged.size());
      List<String> head = next.subList(0, Math.min(contextWindowWords, next.size()));
      MatchResult match = LongestMatchFinder.findSuffixMatch(tail, head, minMatchWords);

      if (match.hasMatch()) {
        LOGGER.debug(
            "Boundary {}->{}: dropping {} duplicated word(s) {}",
            i - 1,
            i,
            match.text2EndIndex(),
            match.matchedWords());
        merged.addAll(next.subList(match.text2EndIndex(), next.size()));
      } else {
        merged.addAll(next);
      }
    }
    return String.join(" ", merged);
  }

  @Override
  public String getStrategyName() {
    return "WORD_OVERLAP";
  }
}
