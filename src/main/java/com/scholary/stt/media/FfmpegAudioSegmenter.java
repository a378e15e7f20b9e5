package com.scholary.stt.media;

import com.scholary.stt.chunking.ChunkWindow;
import com.scholary.stt.pipeline.AudioSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts chunk windows with ffmpeg, resampled to mono 16-bit PCM WAV.
 *
 * <p>Seeking uses {@code -ss} before {@code -i} with an explicit {@code -t} length, so ffmpeg
 * decodes only the requested span. Input is always re-encoded, whatever the source codec.
 */
@Component
public class FfmpegAudioSegmenter implements AudioSegmenter {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioSegmenter.class);

  private static final Duration VERSION_CHECK_TIMEOUT = Duration.ofSeconds(10);
  /** Float slack allowed when a window ends exactly on the probed duration. */
  private static final double RANGE_TOLERANCE_SECONDS = 1e-6;

  private final ProcessRunner processRunner;
  private final MediaProperties properties;

  public FfmpegAudioSegmenter(ProcessRunner processRunner, MediaProperties properties) {
    this.processRunner = processRunner;
    this.properties = properties;
  }

  @Override
  public void extract(AudioSource source, ChunkWindow window, Path target) {
    if (!Files.isReadable(source.file())) {
      throw new SegmentExtractionException("Source file unreadable: " + source.file());
    }
    if (window.end() > source.durationSeconds() + RANGE_TOLERANCE_SECONDS) {
      throw new SegmentExtractionException(
          String.format(
              "Window %d [%.3f-%.3f] is outside clip duration %.3fs",
              window.index(), window.start(), window.end(), source.durationSeconds()));
    }

    List<String> command =
        List.of(
            properties.ffmpegPath(),
            "-v",
            "error",
            "-ss",
            formatSeconds(window.start()),
            "-t",
            formatSeconds(window.duration()),
            "-i",
            source.file().toAbsolutePath().toString(),
            "-ac",
            "1",
            "-ar",
            String.valueOf(properties.sampleRate()),
            "-c:a",
            "pcm_s16le",
            "-y",
            target.toAbsolutePath().toString());

    ProcessRunner.ProcessResult result;
    try {
      result = processRunner.run(command, properties.processTimeout());
    } catch (IOException e) {
      throw new ExtractionUnavailableException("ffmpeg could not be started: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SegmentExtractionException("Interrupted while extracting chunk " + window.index(), e);
    }

    if (result.timedOut()) {
      throw new SegmentExtractionException("ffmpeg timed out on chunk " + window.index());
    }
    if (result.exitCode() != 0) {
      throw new SegmentExtractionException(
          String.format(
              "ffmpeg failed on chunk %d (exit=%d): %s",
              window.index(), result.exitCode(), result.output()));
    }
    if (!Files.isRegularFile(target)) {
      throw new SegmentExtractionException("ffmpeg produced no output for chunk " + window.index());
    }

    LOGGER.debug(
        "Extracted chunk {}: [{}-{}] -> {}",
        window.index(),
        window.start(),
        window.end(),
        target.getFileName());
  }

  @Override
  public boolean isAvailable() {
    try {
      ProcessRunner.ProcessResult result =
          processRunner.run(List.of(properties.ffmpegPath(), "-version"), VERSION_CHECK_TIMEOUT);
      if (!result.succeeded()) {
        LOGGER.warn("ffmpeg -version failed (exit={})", result.exitCode());
        return false;
      }
      return true;
    } catch (IOException e) {
      LOGGER.warn("ffmpeg not available: {}", e.getMessage());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static String formatSeconds(double seconds) {
    return String.format(Locale.ROOT, "%.3f", seconds);
  }
}
