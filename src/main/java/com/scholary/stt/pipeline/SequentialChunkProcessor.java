package com.scholary.stt.pipeline;

import com.scholary.stt.chunking.ChunkWindow;
import com.scholary.stt.engine.EngineException;
import com.scholary.stt.engine.EngineGate;
import com.scholary.stt.engine.EngineResult;
import com.scholary.stt.logging.PipelineEventLogger;
import com.scholary.stt.media.AudioSegmenter;
import com.scholary.stt.media.SegmentExtractionException;
import com.scholary.stt.transcript.ChunkResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drives the engine over chunk windows, strictly one at a time.
 *
 * <p>Per window: extract the segment, transcribe it, record the result, delete the segment. A
 * failure to extract or transcribe marks that chunk failed and the loop moves on; there are no
 * retries. The segment file is always deleted before the next window starts, so at most one
 * exists on disk.
 *
 * <p>A clip that fits in one window goes through the same path as a single window covering the
 * whole clip, so the engine always receives a resampled mono 16 kHz segment. Only when the
 * extraction tool is unavailable is the source file handed to the engine unconverted.
 *
 * <p>The loop stops starting new chunks once the shared state is cancelled. The chunk in flight is
 * allowed to finish.
 */
@Component
public class SequentialChunkProcessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(SequentialChunkProcessor.class);
  private static final PipelineEventLogger EVENTS = new PipelineEventLogger(LOGGER);

  static final String SEGMENT_NAME_FORMAT = "chunk_%04d.wav";
  static final String NOT_STARTED = "Not started: deadline exceeded";

  private final AudioSegmenter segmenter;
  private final EngineGate engine;

  public SequentialChunkProcessor(AudioSegmenter segmenter, EngineGate engine) {
    this.segmenter = segmenter;
    this.engine = engine;
  }

  /**
   * Process every window in order.
   *
   * <p>If the extraction tool is unavailable, chunking is abandoned once and the whole file is
   * transcribed in a single pass instead.
   *
   * @param source probed source audio
   * @param windows planned windows, in order
   * @param workDir directory for segment files, owned by the caller
   * @param threads engine threads per call
   * @param state shared progress and cancellation state
   */
  public ChunkRun process(
      AudioSource source, List<ChunkWindow> windows, Path workDir, int threads, ChunkLoopState state) {
    if (!segmenter.isAvailable()) {
      LOGGER.warn(
          "Audio extraction unavailable, falling back to single-pass transcription of {}",
          source.file().getFileName());
      return processWhole(source, threads, state);
    }

    state.start(windows.size());
    List<ChunkResult> results = new ArrayList<>(windows.size());
    for (ChunkWindow window : windows) {
      if (state.isCancelled() || Thread.currentThread().isInterrupted()) {
        ChunkResult skipped = ChunkResult.failed(window, NOT_STARTED);
        results.add(skipped);
        state.skipped(skipped);
        continue;
      }

      ChunkResult result = processChunk(source, window, workDir, threads);
      results.add(result);
      state.completed(result);
      EVENTS.progress(state.processed(), windows.size());
    }
    return new ChunkRun(windows, results, false);
  }

  /** Transcribe the unconverted source file as one window covering the whole clip. */
  private ChunkRun processWhole(AudioSource source, int threads, ChunkLoopState state) {
    ChunkWindow whole = new ChunkWindow(0, 0.0, source.durationSeconds());
    state.start(1);
    ChunkResult result = transcribe(whole, source.file(), source.languageHint(), threads);
    state.completed(result);
    return new ChunkRun(List.of(whole), List.of(result), true);
  }

  private ChunkResult processChunk(
      AudioSource source, ChunkWindow window, Path workDir, int threads) {
    Path segment = workDir.resolve(String.format(SEGMENT_NAME_FORMAT, window.index()));
    EVENTS.chunkStarted(window.index(), window.start(), window.end());
    try {
      try {
        segmenter.extract(source, window, segment);
      } catch (SegmentExtractionException e) {
        EVENTS.chunkFailed(window.index(), e.getClass().getSimpleName(), e.getMessage());
        return ChunkResult.failed(window, "Extraction failed: " + e.getMessage());
      }
      return transcribe(window, segment, source.languageHint(), threads);
    } finally {
      deleteSegment(segment);
    }
  }

  private ChunkResult transcribe(ChunkWindow window, Path audio, String language, int threads) {
    long started = System.currentTimeMillis();
    try {
      EngineResult result = engine.transcribe(audio, language, threads);
      EVENTS.chunkFinished(
          window.index(),
          result.text().length(),
          result.confidence(),
          System.currentTimeMillis() - started);
      return ChunkResult.ok(window, result.text(), result.confidence());
    } catch (EngineException e) {
      EVENTS.chunkFailed(window.index(), e.getClass().getSimpleName(), e.getMessage());
      return ChunkResult.failed(window, "Transcription failed: " + e.getMessage());
    }
  }

  private static void deleteSegment(Path segment) {
    try {
      Files.deleteIfExists(segment);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete segment {}", segment, e);
    }
  }
}
