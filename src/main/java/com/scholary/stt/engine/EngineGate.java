package com.scholary.stt.engine;

import java.nio.file.Path;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Serializes access to the single engine context.
 *
 * <p>Concurrent requests each run their own chunk loop, but only one of them is inside the engine
 * at a time. The lock is fair, so requests take turns chunk by chunk.
 */
@Component
public class EngineGate {

  private static final Logger LOGGER = LoggerFactory.getLogger(EngineGate.class);

  private final EngineAdapter engine;
  private final ReentrantLock lock = new ReentrantLock(true);

  public EngineGate(EngineAdapter engine) {
    this.engine = engine;
  }

  /**
   * Transcribe while holding the engine exclusively.
   *
   * @throws EngineException if the engine fails or the wait is interrupted
   */
  public EngineResult transcribe(Path segment, String language, int threads) {
    try {
      lock.lockInterruptibly();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EngineException("Interrupted while waiting for the engine", e);
    }
    try {
      if (lock.hasQueuedThreads()) {
        LOGGER.debug("Engine busy, {} caller(s) waiting", lock.getQueueLength());
      }
      return engine.transcribe(segment, language, threads);
    } finally {
      lock.unlock();
    }
  }

  public String engineName() {
    return engine.name();
  }
}
