package com.scholary.stt.media;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Reads the container duration with ffprobe. */
@Component
public class FfprobeDurationProber implements DurationProber {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfprobeDurationProber.class);

  private final ProcessRunner processRunner;
  private final MediaProperties properties;

  public FfprobeDurationProber(ProcessRunner processRunner, MediaProperties properties) {
    this.processRunner = processRunner;
    this.properties = properties;
  }

  @Override
  public double probe(Path file) {
    if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
      throw new ProbeException("Audio file not found or unreadable: " + file);
    }
    if (!AudioFormats.isSupported(file)) {
      throw new ProbeException(
          String.format(
              "Unsupported audio format '%s'. Supported: %s",
              AudioFormats.extension(file), AudioFormats.SUPPORTED_EXTENSIONS));
    }

    List<String> command =
        List.of(
            properties.ffprobePath(),
            "-v",
            "error",
            "-show_entries",
            "format=duration",
            "-of",
            "default=noprint_wrappers=1:nokey=1",
            file.toAbsolutePath().toString());

    ProcessRunner.ProcessResult result;
    try {
      result = processRunner.run(command, properties.processTimeout());
    } catch (IOException e) {
      throw new ProbeException("ffprobe could not be started: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProbeException("Interrupted while probing duration", e);
    }

    if (result.timedOut()) {
      throw new ProbeException("ffprobe timed out for " + file.getFileName());
    }
    if (result.exitCode() != 0) {
      throw new ProbeException(
          String.format("ffprobe failed (exit=%d): %s", result.exitCode(), result.output()));
    }

    double seconds = parseDuration(result.output());
    LOGGER.info("Probed duration: file={}, duration={}s", file.getFileName(), seconds);
    return seconds;
  }

  /** ffprobe prints the duration on the last line; earlier lines may be warnings. */
  static double parseDuration(String output) {
    String[] lines = output == null ? new String[0] : output.trim().split("\\R");
    String last = lines.length == 0 ? "" : lines[lines.length - 1].trim();
    double seconds;
    try {
      seconds = Double.parseDouble(last);
    } catch (NumberFormatException e) {
      throw new ProbeException("Invalid duration from ffprobe: '" + last + "'", e);
    }
    if (!(seconds > 0) || Double.isInfinite(seconds)) {
      throw new ProbeException("Invalid duration from ffprobe: " + seconds);
    }
    return seconds;
  }
}
