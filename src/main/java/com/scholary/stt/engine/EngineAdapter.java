package com.scholary.stt.engine;

import java.nio.file.Path;

/**
 * Owned handle to a speech recognition backend.
 *
 * <p>One instance lives for the whole process: it is opened once at startup, reused for every chunk
 * of every request, and closed at shutdown. Implementations are selected by configuration, so the
 * pipeline never knows which backend is active.
 */
public interface EngineAdapter extends AutoCloseable {

  /**
   * Acquire whatever the backend needs (validate binaries, probe a server, load a model).
   *
   * @throws EngineException if the backend is unusable
   */
  void open();

  /**
   * Transcribe one 16 kHz mono PCM segment.
   *
   * @param segment audio file to transcribe
   * @param language language hint, e.g. {@code "vi"} or {@code "auto"}
   * @param threads CPU threads the backend may use for this call
   * @throws EngineException on malformed input or an internal failure
   */
  EngineResult transcribe(Path segment, String language, int threads);

  /** Short backend identifier for logs and diagnostics. */
  String name();

  @Override
  void close();
}
