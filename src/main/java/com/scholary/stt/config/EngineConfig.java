package com.scholary.stt.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.stt.engine.CliWhisperEngine;
import com.scholary.stt.engine.EngineAdapter;
import com.scholary.stt.engine.EngineProperties;
import com.scholary.stt.engine.HttpWhisperEngine;
import com.scholary.stt.media.ProcessRunner;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the speech engine backend.
 *
 * <p>Exactly one {@link EngineAdapter} exists per process. Spring opens it on startup and closes it
 * on shutdown.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(EngineConfig.class);

  @Bean(initMethod = "open", destroyMethod = "close")
  public EngineAdapter engineAdapter(
      EngineProperties properties, ProcessRunner processRunner, ObjectMapper objectMapper) {
    LOGGER.info(
        "Engine backend={}, model={} (~{}MB)",
        properties.backend(),
        properties.model(),
        properties.model().approxMemoryMb());

    return switch (properties.backend()) {
      case HTTP -> new HttpWhisperEngine(properties.http(), objectMapper);
      case CLI ->
          new CliWhisperEngine(
              processRunner,
              objectMapper,
              Path.of(properties.cli().executable()),
              properties.modelPath(),
              Duration.ofSeconds(properties.cli().chunkTimeoutSeconds()));
    };
  }
}
