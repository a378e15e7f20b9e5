package com.scholary.stt.service;

import com.scholary.stt.api.EngineInfoResponse;
import com.scholary.stt.api.TranscriptionRequest;
import com.scholary.stt.config.TranscriptionProperties;
import com.scholary.stt.engine.EngineProperties;
import com.scholary.stt.engine.EngineThreads;
import com.scholary.stt.pipeline.ChunkProgressListener;
import com.scholary.stt.pipeline.PipelineConfig;
import com.scholary.stt.pipeline.PipelineOrchestrator;
import com.scholary.stt.pipeline.TranscriptionOutcome;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Translates API requests into pipeline runs.
 *
 * <p>Request values override the configured defaults field by field.
 */
@Service
public class TranscriptionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionService.class);

  private final PipelineOrchestrator orchestrator;
  private final TranscriptionProperties properties;
  private final EngineProperties engineProperties;

  public TranscriptionService(
      PipelineOrchestrator orchestrator,
      TranscriptionProperties properties,
      EngineProperties engineProperties) {
    this.orchestrator = orchestrator;
    this.properties = properties;
    this.engineProperties = engineProperties;
  }

  public TranscriptionOutcome transcribe(TranscriptionRequest request) {
    return transcribe(request, ChunkProgressListener.NONE);
  }

  /**
   * Run the pipeline for a request.
   *
   * @throws com.scholary.stt.chunking.ChunkingConfigurationException if the merged settings are
   *     invalid
   * @throws java.nio.file.InvalidPathException if the file path is unusable
   */
  public TranscriptionOutcome transcribe(
      TranscriptionRequest request, ChunkProgressListener listener) {
    PipelineConfig config = toPipelineConfig(request);
    Path source = sourcePath(request);
    LOGGER.info("Transcription request: file={}, language={}", request.filePath(), request.language());
    return orchestrator.run(source, request.language(), config, listener);
  }

  /**
   * Resolve the request's audio file path.
   *
   * @throws java.nio.file.InvalidPathException if the path cannot be represented on this platform
   */
  public Path sourcePath(TranscriptionRequest request) {
    return Path.of(request.filePath());
  }

  public PipelineConfig toPipelineConfig(TranscriptionRequest request) {
    PipelineConfig config =
        properties
            .defaultPipelineConfig()
            .withOverrides(
                request.chunkLengthSeconds(),
                request.overlapSeconds(),
                request.baseTimeoutSeconds(),
                request.timeoutMultiplier(),
                request.maxThreads());
    config.validate();
    return config;
  }

  public EngineInfoResponse engineInfo() {
    return new EngineInfoResponse(
        engineProperties.backend().name(),
        engineProperties.model().name(),
        engineProperties.model().fileName(),
        engineProperties.model().approxMemoryMb(),
        EngineThreads.resolve(properties.maxThreads(), properties.threadCap()),
        properties.threadCap(),
        properties.defaultLanguage());
  }
}
