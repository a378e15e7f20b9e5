package com.scholary.stt.transcript;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Finds the longest run of words that closes one word list and reappears in another.
 *
 * <p>Comparison ignores case and sentence punctuation, so {@code "world."} matches
 * {@code "World"}.
 */
public final class LongestMatchFinder {

  private LongestMatchFinder() {}

  /**
   * Result of a match search.
   *
   * @param matchLength number of consecutive words that matched
   * @param text1EndIndex index in text1 where the match ends (exclusive)
   * @param text2StartIndex index in text2 where the match starts (inclusive)
   * @param matchedWords the matched words as they appear in text1
   */
  public record MatchResult(
      int matchLength, int text1EndIndex, int text2StartIndex, List<String> matchedWords) {

    static final MatchResult NONE = new MatchResult(0, 0, 0, List.of());

    public boolean hasMatch() {
      return matchLength > 0;
    }

    /** Index in text2 of the first word after the match. */
    public int text2EndIndex() {
      return text2StartIndex + matchLength;
    }
  }

  /**
   * Find the longest run of words that ends {@code text1Words} and also appears in
   * {@code text2Words}.
   *
   * <p>Ties go to the earliest start in {@code text2Words}. Words of {@code text1Words} after the
   * match would otherwise be left between the two copies, so only runs ending at its last word
   * count.
   *
   * @param minMatchLength shortest run accepted as a match
   * @return the match, with {@code text1EndIndex == text1Words.size()}, or an empty result
   */
  public static MatchResult findSuffixMatch(
      List<String> text1Words, List<String> text2Words, int minMatchLength) {
    if (text1Words.isEmpty() || text2Words.isEmpty()) {
      return MatchResult.NONE;
    }

    List<String> left = normalize(text1Words);
    List<String> right = normalize(text2Words);
    int end = left.size();
    int shortest = Math.max(1, minMatchLength);
    for (int length = Math.min(end, right.size()); length >= shortest; length--) {
      List<String> suffix = left.subList(end - length, end);
      if (suffix.contains("")) {
        continue;
      }
      int start = Collections.indexOfSubList(right, suffix);
      if (start >= 0) {
        return new MatchResult(
            length, end, start, List.copyOf(text1Words.subList(end - length, end)));
      }
    }
    return MatchResult.NONE;
  }

  /** Split text on whitespace, dropping empty tokens. */
  public static List<String> extractWords(String text) {
    List<String> words = new ArrayList<>();
    for (String word : text.split("\\s+")) {
      if (!word.isEmpty()) {
        words.add(word);
      }
    }
    return words;
  }

  private static List<String> normalize(List<String> words) {
    List<String> normalized = new ArrayList<>(words.size());
    for (String word : words) {
      normalized.add(word.toLowerCase(Locale.ROOT).replaceAll("[.,!?;:'\"]", "").trim());
    }
    return normalized;
  }
}
