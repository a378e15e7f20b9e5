package com.scholary.stt.media;

/** The duration of a source file could not be determined. */
public class ProbeException extends RuntimeException {

  public ProbeException(String message) {
    super(message);
  }

  public ProbeException(String message, Throwable cause) {
    super(message, cause);
  }
}
