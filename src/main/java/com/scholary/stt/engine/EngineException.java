package com.scholary.stt.engine;

/**
 * Thrown when the speech engine cannot transcribe a segment.
 *
 * <p>This could be malformed audio, a crashed subprocess, an unreachable server, or an unreadable
 * response.
 */
public class EngineException extends RuntimeException {

  public EngineException(String message) {
    super(message);
  }

  public EngineException(String message, Throwable cause) {
    super(message, cause);
  }
}
