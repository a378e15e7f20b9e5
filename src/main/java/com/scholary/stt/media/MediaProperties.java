package com.scholary.stt.media;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the ffmpeg/ffprobe binaries.
 *
 * <p>Paths may be bare executable names resolved from {@code PATH}.
 */
@ConfigurationProperties(prefix = "media")
@Validated
public record MediaProperties(
    @NotBlank String ffmpegPath,
    @NotBlank String ffprobePath,
    @Positive int processTimeoutSeconds,
    @Positive int sampleRate) {

  public Duration processTimeout() {
    return Duration.ofSeconds(processTimeoutSeconds);
  }
}
