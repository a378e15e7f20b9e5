package com.scholary.stt.chunking;

/**
 * Raised when chunk or timeout settings are inconsistent.
 *
 * <p>Always thrown before any file is touched, so the caller can reject the request outright.
 */
public class ChunkingConfigurationException extends IllegalArgumentException {

  public ChunkingConfigurationException(String message) {
    super(message);
  }
}
