package com.scholary.stt.media;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external command to completion.
 *
 * <p>Exists so ffmpeg, ffprobe and whisper-cli invocations can be faked in tests without spawning
 * real processes.
 */
public interface ProcessRunner {

  /**
   * Run a command and wait for it, up to {@code timeout}.
   *
   * @param command executable followed by its arguments
   * @param timeout maximum wall time before the process is killed
   * @return exit code and combined stdout/stderr
   * @throws IOException if the process cannot be started
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  ProcessResult run(List<String> command, Duration timeout)
      throws IOException, InterruptedException;

  /**
   * Outcome of a finished (or killed) process.
   *
   * @param exitCode process exit code, -1 when killed on timeout
   * @param output combined stdout and stderr
   * @param timedOut whether the process was killed because it ran past the timeout
   */
  record ProcessResult(int exitCode, String output, boolean timedOut) {

    public boolean succeeded() {
      return !timedOut && exitCode == 0;
    }
  }
}
