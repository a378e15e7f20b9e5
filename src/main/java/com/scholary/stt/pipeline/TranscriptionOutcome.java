package com.scholary.stt.pipeline;

import com.scholary.stt.transcript.ChunkResult;
import java.util.List;

/**
 * Terminal result of one transcription, handed to the request layer.
 *
 * @param status overall status
 * @param transcript merged text, empty when nothing succeeded
 * @param duration probed audio duration in seconds, 0 if probing failed
 * @param confidence mean confidence over successful chunks
 * @param processingTime wall time in seconds
 * @param chunksProcessed chunks that ran to completion, successfully or not
 * @param chunksTotal planned chunks
 * @param error reason for a failed or timed out outcome, otherwise null
 * @param chunks per-window results in index order, with their time range; empty when the chunk
 *     loop never ran
 */
public record TranscriptionOutcome(
    OutcomeStatus status,
    String transcript,
    double duration,
    double confidence,
    double processingTime,
    int chunksProcessed,
    int chunksTotal,
    String error,
    List<ChunkResult> chunks) {

  public TranscriptionOutcome {
    chunks = chunks == null ? List.of() : List.copyOf(chunks);
  }

  public static TranscriptionOutcome failed(
      String error, double duration, double processingTime, int chunksProcessed, int chunksTotal) {
    return failed(error, duration, processingTime, chunksProcessed, chunksTotal, List.of());
  }

  public static TranscriptionOutcome failed(
      String error,
      double duration,
      double processingTime,
      int chunksProcessed,
      int chunksTotal,
      List<ChunkResult> chunks) {
    return new TranscriptionOutcome(
        OutcomeStatus.FAILED,
        "",
        duration,
        0.0,
        processingTime,
        chunksProcessed,
        chunksTotal,
        error,
        chunks);
  }
}
