package com.scholary.stt.pipeline;

import com.scholary.stt.chunking.AdaptiveTimeout;
import com.scholary.stt.chunking.ChunkWindow;
import com.scholary.stt.chunking.ChunkingConfigurationException;
import com.scholary.stt.chunking.OverlapChunkPlanner;
import com.scholary.stt.chunking.TimeoutBudget;
import com.scholary.stt.config.TranscriptionProperties;
import com.scholary.stt.engine.EngineThreads;
import com.scholary.stt.logging.PipelineEventLogger;
import com.scholary.stt.media.DurationProber;
import com.scholary.stt.media.ProbeException;
import com.scholary.stt.transcript.ChunkResult;
import com.scholary.stt.transcript.MergedTranscript;
import com.scholary.stt.transcript.TranscriptMerger;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

/**
 * Entry point of the transcription core.
 *
 * <p>Flow:
 *
 * <ol>
 *   <li>Validate the configuration (the only failure that is thrown rather than returned)
 *   <li>Probe the source duration and start the deadline clock
 *   <li>Plan windows; a clip that fits in one window takes the fast path, which skips the disk
 *       check and converts the whole clip into a single segment
 *   <li>For chunked clips, check disk space, then run the sequential chunk loop
 *   <li>Merge the results and derive the status
 * </ol>
 *
 * <p>The chunk loop runs on the pipeline executor while the calling thread waits for at most the
 * remaining budget. On expiry the loop is told to stop, the chunk in flight gets a grace period to
 * finish, and the outcome is built from whatever completed. A loop still queued behind other
 * requests at that point is abandoned without waiting.
 *
 * <p>Every temporary file lives under a per-request work directory that is deleted before
 * {@link #run} returns.
 */
@Service
public class PipelineOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);
  private static final PipelineEventLogger EVENTS = new PipelineEventLogger(LOGGER);

  static final String ALL_CHUNKS_FAILED = "All chunks failed";

  private final DurationProber prober;
  private final OverlapChunkPlanner planner;
  private final SequentialChunkProcessor processor;
  private final TranscriptMerger merger;
  private final DiskSpaceGuard diskSpaceGuard;
  private final AsyncTaskExecutor executor;
  private final Path tempRoot;
  private final int threadCap;
  private final String defaultLanguage;
  private final Duration cancelGrace;

  public PipelineOrchestrator(
      DurationProber prober,
      OverlapChunkPlanner planner,
      SequentialChunkProcessor processor,
      TranscriptMerger merger,
      DiskSpaceGuard diskSpaceGuard,
      @Qualifier("pipelineExecutor") AsyncTaskExecutor executor,
      TranscriptionProperties properties) {
    this.prober = prober;
    this.planner = planner;
    this.processor = processor;
    this.merger = merger;
    this.diskSpaceGuard = diskSpaceGuard;
    this.executor = executor;
    this.tempRoot = Path.of(properties.tempDir());
    this.threadCap = properties.threadCap();
    this.defaultLanguage = properties.defaultLanguage();
    this.cancelGrace = Duration.ofSeconds(properties.cancelGraceSeconds());
  }

  public TranscriptionOutcome run(Path sourceFile, String languageHint, PipelineConfig config) {
    return run(sourceFile, languageHint, config, ChunkProgressListener.NONE);
  }

  /**
   * Transcribe a local audio file.
   *
   * @param sourceFile already downloaded audio file
   * @param languageHint language for the engine, or null for the configured default
   * @param config chunking and timeout settings
   * @param listener notified after each chunk
   * @return the outcome; failures are reported through its status
   * @throws ChunkingConfigurationException if {@code config} is invalid, before any work starts
   */
  public TranscriptionOutcome run(
      Path sourceFile, String languageHint, PipelineConfig config, ChunkProgressListener listener) {
    config.validate();

    long startedAt = System.nanoTime();
    String correlationId = MDC.get(PipelineEventLogger.CORRELATION_ID);
    boolean ownsCorrelationId = correlationId == null;
    if (ownsCorrelationId) {
      correlationId = UUID.randomUUID().toString();
      MDC.put(PipelineEventLogger.CORRELATION_ID, correlationId);
    }

    Path workDir = tempRoot.resolve("req-" + correlationId);
    ChunkLoopState state = new ChunkLoopState(listener);
    double duration = 0.0;
    TranscriptionOutcome outcome;
    try {
      duration = prober.probe(sourceFile);
      String language =
          languageHint == null || languageHint.isBlank() ? defaultLanguage : languageHint;
      AudioSource source = new AudioSource(sourceFile, duration, language);
      TimeoutBudget budget =
          new TimeoutBudget(
              AdaptiveTimeout.compute(
                  duration, config.baseTimeoutSeconds(), config.timeoutMultiplier()),
              startedAt);
      List<ChunkWindow> windows =
          planner.plan(duration, config.chunkLengthSeconds(), config.overlapSeconds());
      int threads = EngineThreads.resolve(config.maxThreads(), threadCap);

      LOGGER.info(
          "Starting transcription: file={}, duration={}s, windows={}, deadline={}s, threads={}",
          sourceFile.getFileName(),
          duration,
          windows.size(),
          budget.deadlineSeconds(),
          threads);

      Files.createDirectories(workDir);
      if (windows.size() > 1) {
        diskSpaceGuard.check(workDir, config.chunkLengthSeconds());
      } else {
        LOGGER.debug("Clip fits in one window, taking the fast path");
      }
      Future<ChunkRun> future =
          submit(() -> processor.process(source, windows, workDir, threads, state), state);

      outcome = await(future, budget, state, windows, duration, startedAt);
    } catch (ProbeException e) {
      LOGGER.error("Probe failed for {}: {}", sourceFile, e.getMessage());
      outcome = TranscriptionOutcome.failed(e.getMessage(), 0.0, secondsSince(startedAt), 0, 0);
    } catch (InsufficientDiskSpaceException e) {
      LOGGER.error("Disk check failed: {}", e.getMessage());
      outcome =
          TranscriptionOutcome.failed(e.getMessage(), duration, secondsSince(startedAt), 0, 0);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      state.cancel();
      outcome =
          TranscriptionOutcome.failed(
              "Interrupted", duration, secondsSince(startedAt), state.processed(), state.total());
    } catch (IOException | RuntimeException e) {
      LOGGER.error("Transcription failed for {}", sourceFile, e);
      outcome =
          TranscriptionOutcome.failed(
              e.getMessage(), duration, secondsSince(startedAt), state.processed(), state.total());
    } finally {
      cleanup(workDir);
      if (ownsCorrelationId) {
        MDC.remove(PipelineEventLogger.CORRELATION_ID);
      }
    }

    EVENTS.outcome(
        outcome.status().name(),
        outcome.chunksProcessed(),
        outcome.chunksTotal(),
        outcome.duration(),
        outcome.processingTime());
    return outcome;
  }

  private Future<ChunkRun> submit(ChunkTask task, ChunkLoopState state) {
    String correlationId = MDC.get(PipelineEventLogger.CORRELATION_ID);
    return executor.submit(
        () -> {
          MDC.put(PipelineEventLogger.CORRELATION_ID, correlationId);
          try {
            if (!state.begin()) {
              return null;
            }
            return task.run();
          } finally {
            MDC.remove(PipelineEventLogger.CORRELATION_ID);
            state.markFinished();
          }
        });
  }

  private TranscriptionOutcome await(
      Future<ChunkRun> future,
      TimeoutBudget budget,
      ChunkLoopState state,
      List<ChunkWindow> windows,
      double duration,
      long startedAt)
      throws InterruptedException {
    try {
      ChunkRun run = future.get(budget.remaining().toNanos(), TimeUnit.NANOSECONDS);
      return complete(run, duration, state.processed(), startedAt);
    } catch (TimeoutException e) {
      return timeOut(future, budget, state, windows, duration, startedAt);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      LOGGER.error("Chunk loop failed", cause);
      return TranscriptionOutcome.failed(
          cause.getMessage(),
          duration,
          secondsSince(startedAt),
          state.processed(),
          windows.size(),
          state.results());
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    }
  }

  private TranscriptionOutcome timeOut(
      Future<ChunkRun> future,
      TimeoutBudget budget,
      ChunkLoopState state,
      List<ChunkWindow> windows,
      double duration,
      long startedAt)
      throws InterruptedException {
    LOGGER.warn(
        "Deadline of {}s exceeded after {}/{} chunks, stopping",
        budget.deadlineSeconds(),
        state.processed(),
        windows.size());
    state.cancel();
    if (state.abandonIfNotStarted()) {
      future.cancel(false);
      LOGGER.warn("Chunk loop was still queued at the deadline, abandoned");
    } else if (!state.awaitFinished(cancelGrace)) {
      future.cancel(true);
      if (!state.awaitFinished(cancelGrace)) {
        LOGGER.warn("Chunk loop did not stop within {}s of cancellation", cancelGrace.toSeconds());
      }
    }

    List<ChunkResult> completed = state.results();
    MergedTranscript merged = merger.merge(completed);
    return new TranscriptionOutcome(
        OutcomeStatus.TIMEOUT,
        merged.text(),
        duration,
        merged.confidence(),
        secondsSince(startedAt),
        state.processed(),
        windows.size(),
        String.format("Timed out after %.1fs", budget.deadlineSeconds()),
        withUnstarted(windows, completed));
  }

  /** One result per planned window; windows the loop never reached are marked not started. */
  private static List<ChunkResult> withUnstarted(
      List<ChunkWindow> windows, List<ChunkResult> completed) {
    Map<Integer, ChunkResult> byIndex = new HashMap<>();
    for (ChunkResult result : completed) {
      byIndex.put(result.index(), result);
    }
    List<ChunkResult> chunks = new ArrayList<>(windows.size());
    for (ChunkWindow window : windows) {
      ChunkResult result = byIndex.get(window.index());
      chunks.add(
          result != null
              ? result
              : ChunkResult.failed(window, SequentialChunkProcessor.NOT_STARTED));
    }
    return chunks;
  }

  private TranscriptionOutcome complete(
      ChunkRun run, double duration, int processed, long startedAt) {
    MergedTranscript merged = merger.merge(run.results());
    long okCount = run.results().stream().filter(ChunkResult::isOk).count();
    int total = run.windows().size();

    if (okCount == 0) {
      return TranscriptionOutcome.failed(
          ALL_CHUNKS_FAILED, duration, secondsSince(startedAt), processed, total, run.results());
    }
    OutcomeStatus status = okCount == total ? OutcomeStatus.SUCCESS : OutcomeStatus.PARTIAL;
    String error =
        status == OutcomeStatus.PARTIAL
            ? String.format("%d of %d chunks failed", total - okCount, total)
            : null;
    if (run.fallback()) {
      LOGGER.info("Completed via single-pass fallback");
    }
    return new TranscriptionOutcome(
        status,
        merged.text(),
        duration,
        merged.confidence(),
        secondsSince(startedAt),
        processed,
        total,
        error,
        run.results());
  }

  private static void cleanup(Path workDir) {
    try {
      if (FileSystemUtils.deleteRecursively(workDir)) {
        LOGGER.debug("Deleted work directory {}", workDir);
      }
    } catch (IOException e) {
      LOGGER.warn("Failed to delete work directory {}", workDir, e);
    }
  }

  private static double secondsSince(long startedAtNanos) {
    return (System.nanoTime() - startedAtNanos) / 1_000_000_000.0;
  }

  @FunctionalInterface
  private interface ChunkTask {
    ChunkRun run();
  }
}
