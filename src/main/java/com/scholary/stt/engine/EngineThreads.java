package com.scholary.stt.engine;

/** Resolves how many CPU threads the engine may use for one call. */
public final class EngineThreads {

  private EngineThreads() {}

  /**
   * @param configured requested threads, {@code <= 0} means auto-detect
   * @param cap upper bound
   * @return a value in {@code [1, cap]}
   */
  public static int resolve(int configured, int cap) {
    return resolve(configured, cap, Runtime.getRuntime().availableProcessors());
  }

  static int resolve(int configured, int cap, int availableProcessors) {
    if (cap < 1) {
      throw new IllegalArgumentException("Thread cap must be >= 1, got " + cap);
    }
    int wanted = configured > 0 ? configured : availableProcessors;
    return Math.max(1, Math.min(wanted, cap));
  }
}
