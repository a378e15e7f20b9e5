package com.scholary.stt.media;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link ProcessRunner} backed by {@link ProcessBuilder}.
 *
 * <p>stderr is merged into stdout and drained on a daemon thread so a chatty process can never
 * block on a full pipe. Output beyond {@value #MAX_OUTPUT_CHARS} characters is discarded.
 */
@Component
public class DefaultProcessRunner implements ProcessRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultProcessRunner.class);

  static final int MAX_OUTPUT_CHARS = 64 * 1024;
  private static final long GOBBLER_JOIN_MS = 1_000;
  private static final long GRACEFUL_SHUTDOWN_MS = 2_000;

  @Override
  public ProcessResult run(List<String> command, Duration timeout)
      throws IOException, InterruptedException {
    LOGGER.debug("Running command: {}", String.join(" ", command));

    ProcessBuilder pb = new ProcessBuilder(command);
    pb.redirectErrorStream(true);
    Process process = pb.start();

    StringBuilder output = new StringBuilder();
    Thread gobbler = startGobbler(process.getInputStream(), output, command.get(0));

    try {
      boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!finished) {
        LOGGER.warn("Command timed out after {}ms: {}", timeout.toMillis(), command.get(0));
        destroy(process);
        gobbler.join(GOBBLER_JOIN_MS);
        return new ProcessResult(-1, snapshot(output), true);
      }
      gobbler.join(GOBBLER_JOIN_MS);
      return new ProcessResult(process.exitValue(), snapshot(output), false);
    } catch (InterruptedException e) {
      destroy(process);
      throw e;
    }
  }

  private static String snapshot(StringBuilder output) {
    synchronized (output) {
      return output.toString().trim();
    }
  }

  private static Thread startGobbler(InputStream in, StringBuilder sink, String name) {
    Thread thread =
        new Thread(
            () -> {
              try (BufferedReader reader =
                  new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                  synchronized (sink) {
                    if (sink.length() < MAX_OUTPUT_CHARS) {
                      sink.append(line).append('\n');
                    }
                  }
                }
              } catch (IOException e) {
                LOGGER.debug("Output reader for '{}' stopped: {}", name, e.toString());
              }
            },
            "proc-out-" + name);
    thread.setDaemon(true);
    thread.start();
    return thread;
  }

  private static void destroy(Process process) {
    process.destroy();
    try {
      if (!process.waitFor(GRACEFUL_SHUTDOWN_MS, TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
    }
  }
}
