package com.scholary.stt.chunking;

import java.time.Duration;

/**
 * Deadline fixed at the start of an operation.
 *
 * @param deadlineSeconds total seconds allowed
 * @param startedAtNanos {@link System#nanoTime()} when the clock started
 */
public record TimeoutBudget(double deadlineSeconds, long startedAtNanos) {

  public static TimeoutBudget start(double deadlineSeconds) {
    return new TimeoutBudget(deadlineSeconds, System.nanoTime());
  }

  public static TimeoutBudget forDuration(
      double durationSeconds, double baseTimeoutSeconds, double multiplier) {
    return start(AdaptiveTimeout.compute(durationSeconds, baseTimeoutSeconds, multiplier));
  }

  public Duration elapsed() {
    return Duration.ofNanos(System.nanoTime() - startedAtNanos);
  }

  /** Time left before the deadline, never negative. */
  public Duration remaining() {
    long deadlineNanos = (long) (deadlineSeconds * 1_000_000_000L);
    long left = deadlineNanos - (System.nanoTime() - startedAtNanos);
    return Duration.ofNanos(Math.max(0L, left));
  }

  public boolean isExpired() {
    return remaining().isZero();
  }
}
