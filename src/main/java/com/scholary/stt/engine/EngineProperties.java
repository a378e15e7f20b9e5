package com.scholary.stt.engine;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the speech engine backend.
 *
 * <p>Resolved once at startup. Changing the backend or model requires a restart.
 */
@ConfigurationProperties(prefix = "engine")
@Validated
public record EngineProperties(
    @NotNull Backend backend,
    @NotNull WhisperModel model,
    @NotBlank String modelsDir,
    @Valid @NotNull HttpProperties http,
    @Valid @NotNull CliProperties cli) {

  public enum Backend {
    HTTP,
    CLI
  }

  public Path modelPath() {
    return Path.of(modelsDir).resolve(model.fileName());
  }

  public record HttpProperties(
      @NotBlank String baseUrl,
      @NotBlank String inferencePath,
      @Positive int connectTimeoutSeconds,
      @Positive int readTimeoutSeconds) {}

  public record CliProperties(@NotBlank String executable, @Positive int chunkTimeoutSeconds) {}
}
