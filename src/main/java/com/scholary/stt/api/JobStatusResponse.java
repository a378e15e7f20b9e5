package com.scholary.stt.api;

import com.scholary.stt.pipeline.TranscriptionOutcome;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async job and includes the outcome once it has finished.
 */
public record JobStatusResponse(
    String jobId,
    Status status,
    int chunksProcessed,
    int chunksTotal,
    TranscriptionOutcome outcome,
    String error) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }
}
