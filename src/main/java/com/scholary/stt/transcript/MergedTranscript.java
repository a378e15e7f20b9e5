package com.scholary.stt.transcript;

/** Joined transcript text and mean confidence over successful chunks. */
public record MergedTranscript(String text, double confidence) {

  public static MergedTranscript empty() {
    return new MergedTranscript("", 0.0);
  }
}
