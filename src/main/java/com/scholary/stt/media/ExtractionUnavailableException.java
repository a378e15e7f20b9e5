package com.scholary.stt.media;

/** The extraction tool itself is missing or cannot be started. */
public class ExtractionUnavailableException extends SegmentExtractionException {

  public ExtractionUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
