package com.scholary.stt.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Emits pipeline events with structured MDC fields.
 *
 * <p>Each event puts its fields into the MDC for the duration of one log call, so a JSON encoder
 * or log shipper can index them; the fields are removed again afterwards.
 */
public class PipelineEventLogger {

  public static final String CORRELATION_ID = "correlationId";
  public static final String JOB_ID = "jobId";

  private final Logger logger;

  public PipelineEventLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log chunk started event. */
  public void chunkStarted(int chunkIndex, double start, double end) {
    try {
      MDC.put("event_type", "chunk_started");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));

      logger.debug("Chunk started: index={}, range=[{}-{}]", chunkIndex, start, end);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk finished event. */
  public void chunkFinished(int chunkIndex, int chars, double confidence, long elapsedMs) {
    try {
      MDC.put("event_type", "chunk_finished");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("chars", String.valueOf(chars));
      MDC.put("confidence", String.valueOf(confidence));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.debug(
          "Chunk finished: index={}, chars={}, confidence={}, took={}ms",
          chunkIndex,
          chars,
          confidence,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk failure; the loop continues with the next window. */
  public void chunkFailed(int chunkIndex, String errorType, String message) {
    try {
      MDC.put("event_type", "chunk_failed");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("errorType", errorType);

      logger.warn("Chunk failed: index={}, error={}, message={}", chunkIndex, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log progress after a chunk. */
  public void progress(int chunksProcessed, int chunksTotal) {
    int percent = chunksTotal == 0 ? 100 : (chunksProcessed * 100) / chunksTotal;
    try {
      MDC.put("event_type", "pipeline_progress");
      MDC.put("chunksProcessed", String.valueOf(chunksProcessed));
      MDC.put("chunksTotal", String.valueOf(chunksTotal));
      MDC.put("percentComplete", String.valueOf(percent));

      logger.info("Progress: {}% ({}/{} chunks)", percent, chunksProcessed, chunksTotal);
    } finally {
      clearEventFields();
    }
  }

  /** Log the terminal outcome of a transcription. */
  public void outcome(
      String status, int chunksProcessed, int chunksTotal, double durationSeconds, double seconds) {
    try {
      MDC.put("event_type", "pipeline_outcome");
      MDC.put("status", status);
      MDC.put("chunksProcessed", String.valueOf(chunksProcessed));
      MDC.put("chunksTotal", String.valueOf(chunksTotal));
      MDC.put("durationSeconds", String.valueOf(durationSeconds));
      MDC.put("processingSeconds", String.valueOf(seconds));

      logger.info(
          "Transcription {}: chunks={}/{}, audio={}s, took={}s",
          status,
          chunksProcessed,
          chunksTotal,
          durationSeconds,
          seconds);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId) {
    MDC.put(JOB_ID, jobId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove(JOB_ID);
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("chunk_index");
    MDC.remove("start");
    MDC.remove("end");
    MDC.remove("chars");
    MDC.remove("confidence");
    MDC.remove("elapsedMs");
    MDC.remove("errorType");
    MDC.remove("chunksProcessed");
    MDC.remove("chunksTotal");
    MDC.remove("percentComplete");
    MDC.remove("status");
    MDC.remove("durationSeconds");
    MDC.remove("processingSeconds");
  }
}
