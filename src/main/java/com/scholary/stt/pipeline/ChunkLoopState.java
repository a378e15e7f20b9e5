package com.scholary.stt.pipeline;

import com.scholary.stt.transcript.ChunkResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * State shared between the chunk loop thread and the thread enforcing the deadline.
 *
 * <p>Results are collected as they complete so a timed out request can still merge what finished.
 */
public class ChunkLoopState {

  private final ChunkProgressListener listener;
  private static final int PENDING = 0;
  private static final int RUNNING = 1;
  private static final int ABANDONED = 2;

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final AtomicInteger phase = new AtomicInteger(PENDING);
  private final AtomicInteger processed = new AtomicInteger();
  private final CountDownLatch finished = new CountDownLatch(1);
  private final List<ChunkResult> results = new ArrayList<>();
  private volatile int total;

  public ChunkLoopState(ChunkProgressListener listener) {
    this.listener = listener == null ? ChunkProgressListener.NONE : listener;
  }

  /**
   * Claim the loop for the worker thread that picked it up.
   *
   * @return false if the loop was abandoned while still queued and must not run
   */
  boolean begin() {
    return phase.compareAndSet(PENDING, RUNNING);
  }

  /**
   * Abandon a loop that no worker has picked up yet.
   *
   * @return true if the loop will never run, false if it already started
   */
  boolean abandonIfNotStarted() {
    return phase.compareAndSet(PENDING, ABANDONED);
  }

  void start(int chunksTotal) {
    this.total = chunksTotal;
  }

  /** Record a completed chunk, bump the counter and notify the listener. */
  void completed(ChunkResult result) {
    synchronized (results) {
      results.add(result);
    }
    listener.onChunkProcessed(processed.incrementAndGet(), total);
  }

  /** Record a window that was never started; it does not count as processed. */
  void skipped(ChunkResult result) {
    synchronized (results) {
      results.add(result);
    }
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  void markFinished() {
    finished.countDown();
  }

  /** @return whether the loop finished within the wait */
  public boolean awaitFinished(Duration wait) throws InterruptedException {
    return finished.await(wait.toMillis(), TimeUnit.MILLISECONDS);
  }

  public int processed() {
    return processed.get();
  }

  public int total() {
    return total;
  }

  public List<ChunkResult> results() {
    synchronized (results) {
      return List.copyOf(results);
    }
  }
}
