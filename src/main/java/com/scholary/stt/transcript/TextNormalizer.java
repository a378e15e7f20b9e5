package com.scholary.stt.transcript;

import java.util.regex.Pattern;

/** Cleans raw engine output before merging. */
public final class TextNormalizer {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern REPEATED_PUNCTUATION = Pattern.compile("([.!?])\\1+");

  private TextNormalizer() {}

  /** Trim, collapse whitespace runs, and collapse repeated sentence punctuation. */
  public static String clean(String text) {
    if (text == null) {
      return "";
    }
    String cleaned = WHITESPACE.matcher(text.trim()).replaceAll(" ");
    return REPEATED_PUNCTUATION.matcher(cleaned).replaceAll("$1");
  }
}
