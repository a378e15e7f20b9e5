package com.scholary.stt.job;

import com.scholary.stt.api.JobStatusResponse.Status;
import com.scholary.stt.api.TranscriptionRequest;
import com.scholary.stt.pipeline.TranscriptionOutcome;

/**
 * Represents an async transcription job.
 *
 * <p>Tracks the job's state, chunk progress, and outcome. Stored in memory using Caffeine cache.
 * Fields are written by the job thread and read by status requests, hence volatile.
 */
public class TranscriptionJob {

  private final String jobId;
  private final TranscriptionRequest request;

  private volatile Status status;
  private volatile int chunksProcessed;
  private volatile int chunksTotal;
  private volatile TranscriptionOutcome outcome;
  private volatile String error;

  public TranscriptionJob(String jobId, TranscriptionRequest request) {
    this.jobId = jobId;
    this.request = request;
    this.status = Status.PENDING;
  }

  public String getJobId() {
    return jobId;
  }

  public TranscriptionRequest getRequest() {
    return request;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public int getChunksProcessed() {
    return chunksProcessed;
  }

  public int getChunksTotal() {
    return chunksTotal;
  }

  public void setProgress(int chunksProcessed, int chunksTotal) {
    this.chunksProcessed = chunksProcessed;
    this.chunksTotal = chunksTotal;
  }

  public TranscriptionOutcome getOutcome() {
    return outcome;
  }

  public void setOutcome(TranscriptionOutcome outcome) {
    this.outcome = outcome;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
