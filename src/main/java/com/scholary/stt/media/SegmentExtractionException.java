package com.scholary.stt.media;

/**
 * A single chunk could not be cut from the source.
 *
 * <p>The chunk is skipped; the rest of the transcription carries on.
 */
public class SegmentExtractionException extends RuntimeException {

  public SegmentExtractionException(String message) {
    super(message);
  }

  public SegmentExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
