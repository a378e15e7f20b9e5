package com.scholary.stt.pipeline;

/** Not enough free space in the work directory for chunk segments. */
public class InsufficientDiskSpaceException extends RuntimeException {

  public InsufficientDiskSpaceException(String message) {
    super(message);
  }

  public InsufficientDiskSpaceException(String message, Throwable cause) {
    super(message, cause);
  }
}
