package com.scholary.stt.transcript;

import java.util.List;

/** Joins chunk texts with a single space. Overlap duplicates are left in place. */
public class ConcatenationMerger implements MergeStrategy {

  @Override
  public String merge(List<String> orderedTexts) {
    return String.join(" ", orderedTexts);
  }

  @Override
  public String getStrategyName() {
    return "CONCATENATION";
  }
}
