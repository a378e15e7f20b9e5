package com.scholary.stt.pipeline;

import com.scholary.stt.config.TranscriptionProperties;
import com.scholary.stt.media.MediaProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Checks free space before a chunk loop starts.
 *
 * <p>Only one segment exists at a time, so the requirement is one 16-bit mono segment scaled by a
 * safety factor, plus a fixed reserve.
 */
@Component
public class DiskSpaceGuard {

  private static final Logger LOGGER = LoggerFactory.getLogger(DiskSpaceGuard.class);
  private static final int BYTES_PER_SAMPLE = 2;

  private final int sampleRate;
  private final double safetyFactor;
  private final long reserveBytes;

  @Autowired
  public DiskSpaceGuard(TranscriptionProperties transcription, MediaProperties media) {
    this(media.sampleRate(), transcription.disk().safetyFactor(), transcription.disk().reserveMb());
  }

  DiskSpaceGuard(int sampleRate, double safetyFactor, long reserveMb) {
    this.sampleRate = sampleRate;
    this.safetyFactor = safetyFactor;
    this.reserveBytes = reserveMb * 1024L * 1024L;
  }

  public long requiredBytes(double chunkLengthSeconds) {
    double segmentBytes = chunkLengthSeconds * sampleRate * BYTES_PER_SAMPLE;
    return (long) Math.ceil(segmentBytes * safetyFactor) + reserveBytes;
  }

  /**
   * @throws InsufficientDiskSpaceException if {@code workDir} lacks room for one segment
   */
  public void check(Path workDir, double chunkLengthSeconds) {
    long required = requiredBytes(chunkLengthSeconds);
    long usable;
    try {
      usable = usableSpace(workDir);
    } catch (IOException e) {
      throw new InsufficientDiskSpaceException("Cannot determine free space in " + workDir, e);
    }
    if (usable < required) {
      throw new InsufficientDiskSpaceException(
          String.format(
              "Insufficient disk space in %s: need %d bytes, have %d", workDir, required, usable));
    }
    LOGGER.debug("Disk check passed: need={} bytes, usable={} bytes", required, usable);
  }

  long usableSpace(Path dir) throws IOException {
    return Files.getFileStore(dir).getUsableSpace();
  }
}
