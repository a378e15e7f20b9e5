package com.scholary.stt.config;

import com.scholary.stt.pipeline.PipelineConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for transcription processing.
 *
 * <p>Supplies the default {@link PipelineConfig}; individual requests may override chunking and
 * timeout values.
 */
@ConfigurationProperties(prefix = "transcription")
@Validated
public record TranscriptionProperties(
    @Positive double chunkLengthSeconds,
    @PositiveOrZero double overlapSeconds,
    @Positive double baseTimeoutSeconds,
    @Positive double timeoutMultiplier,
    @PositiveOrZero int maxThreads,
    @Positive int threadCap,
    @NotBlank String defaultLanguage,
    @NotBlank String tempDir,
    @PositiveOrZero int cancelGraceSeconds,
    @Valid @NotNull MergeProperties merge,
    @Valid @NotNull DiskProperties disk) {

  public PipelineConfig defaultPipelineConfig() {
    return new PipelineConfig(
        chunkLengthSeconds, overlapSeconds, baseTimeoutSeconds, timeoutMultiplier, maxThreads);
  }

  public enum MergeMode {
    CONCATENATION,
    WORD_OVERLAP
  }

  public record MergeProperties(
      @NotNull MergeMode strategy, @Positive int contextWindowWords, @Positive int minMatchWords) {}

  public record DiskProperties(@Positive double safetyFactor, @PositiveOrZero long reserveMb) {}
}
