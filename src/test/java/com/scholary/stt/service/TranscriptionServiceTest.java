package com.scholary.stt.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.stt.api.EngineInfoResponse;
import com.scholary.stt.api.TranscriptionRequest;
import com.scholary.stt.chunking.ChunkingConfigurationException;
import com.scholary.stt.config.TranscriptionProperties;
import com.scholary.stt.config.TranscriptionProperties.DiskProperties;
import com.scholary.stt.config.TranscriptionProperties.MergeMode;
import com.scholary.stt.config.TranscriptionProperties.MergeProperties;
import com.scholary.stt.engine.EngineProperties;
import com.scholary.stt.engine.EngineProperties.Backend;
import com.scholary.stt.engine.EngineProperties.CliProperties;
import com.scholary.stt.engine.EngineProperties.HttpProperties;
import com.scholary.stt.engine.WhisperModel;
import com.scholary.stt.pipeline.ChunkProgressListener;
import com.scholary.stt.pipeline.OutcomeStatus;
import com.scholary.stt.pipeline.PipelineConfig;
import com.scholary.stt.pipeline.PipelineOrchestrator;
import com.scholary.stt.pipeline.TranscriptionOutcome;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TranscriptionServiceTest {

  @Mock private PipelineOrchestrator orchestrator;

  private TranscriptionService service;

  @BeforeEach
  void setUp() {
    TranscriptionProperties properties =
        new TranscriptionProperties(
            30,
            1,
            90,
            1.5,
            2,
            8,
            "vi",
            "/tmp/stt",
            30,
            new MergeProperties(MergeMode.CONCATENATION, 20, 3),
            new DiskProperties(3.0, 100));
    EngineProperties engineProperties =
        new EngineProperties(
            Backend.CLI,
            WhisperModel.MEDIUM,
            "/app/whisper/models",
            new HttpProperties("http://localhost:8081", "/inference", 10, 300),
            new CliProperties("/app/whisper/bin/whisper-cli", 300));
    service = new TranscriptionService(orchestrator, properties, engineProperties);
  }

  @Test
  void transcribe_appliesRequestOverridesOnTopOfDefaults() {
    TranscriptionRequest request =
        new TranscriptionRequest("/data/call.wav", "en", 60.0, null, null, 2.0, null);
    TranscriptionOutcome expected =
        new TranscriptionOutcome(OutcomeStatus.SUCCESS, "hi", 10, 0.9, 1, 1, 1, null, List.of());
    when(orchestrator.run(eq(Path.of("/data/call.wav")), eq("en"), any(PipelineConfig.class), any(ChunkProgressListener.class)))
        .thenReturn(expected);

    TranscriptionOutcome outcome = service.transcribe(request);

    ArgumentCaptor<PipelineConfig> config = ArgumentCaptor.forClass(PipelineConfig.class);
    verify(orchestrator).run(eq(Path.of("/data/call.wav")), eq("en"), config.capture(), any(ChunkProgressListener.class));
    assertThat(config.getValue()).isEqualTo(new PipelineConfig(60, 1, 90, 2.0, 2));
    assertThat(outcome).isSameAs(expected);
  }

  @Test
  void transcribe_invalidOverride_throwsWithoutRunning() {
    TranscriptionRequest request =
        new TranscriptionRequest("/data/call.wav", null, 5.0, 5.0, null, null, null);

    assertThatThrownBy(() -> service.transcribe(request))
        .isInstanceOf(ChunkingConfigurationException.class);
    verifyNoInteractions(orchestrator);
  }

  @Test
  void transcribe_unusablePath_throwsWithoutRunning() {
    TranscriptionRequest request = TranscriptionRequest.of("/data/bad\0name.wav", "vi");

    assertThatThrownBy(() -> service.transcribe(request))
        .isInstanceOf(InvalidPathException.class);
    verifyNoInteractions(orchestrator);
  }

  @Test
  void engineInfo_reportsModelAndResolvedThreads() {
    EngineInfoResponse info = service.engineInfo();

    assertThat(info.backend()).isEqualTo("CLI");
    assertThat(info.modelFile()).isEqualTo("ggml-medium-q5_1.bin");
    assertThat(info.approxMemoryMb()).isEqualTo(2000);
    assertThat(info.threads()).isEqualTo(2);
    assertThat(info.defaultLanguage()).isEqualTo("vi");
  }
}
