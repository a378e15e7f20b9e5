package com.scholary.stt.pipeline;

/** Terminal status of a transcription. */
public enum OutcomeStatus {
  /** Every chunk transcribed. */
  SUCCESS,
  /** At least one chunk failed and at least one succeeded. */
  PARTIAL,
  /** The deadline passed before all chunks were processed. */
  TIMEOUT,
  /** Nothing usable was produced. */
  FAILED
}
