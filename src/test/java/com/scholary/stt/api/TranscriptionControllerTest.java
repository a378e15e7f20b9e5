package com.scholary.stt.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.stt.api.JobStatusResponse.Status;
import com.scholary.stt.chunking.ChunkWindow;
import com.scholary.stt.chunking.ChunkingConfigurationException;
import com.scholary.stt.job.JobRepository;
import com.scholary.stt.job.TranscriptionJob;
import com.scholary.stt.job.TranscriptionJobRunner;
import com.scholary.stt.pipeline.OutcomeStatus;
import com.scholary.stt.pipeline.TranscriptionOutcome;
import com.scholary.stt.service.TranscriptionService;
import com.scholary.stt.transcript.ChunkResult;
import java.nio.file.InvalidPathException;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = TranscriptionController.class)
class TranscriptionControllerTest {

  private static final String BODY = "{\"filePath\":\"/data/call.mp3\",\"language\":\"vi\"}";

  @Autowired private MockMvc mockMvc;

  @MockitoBean private TranscriptionService transcriptionService;

  @MockitoBean private TranscriptionJobRunner jobRunner;

  @MockitoBean private JobRepository jobRepository;

  private static TranscriptionOutcome outcome(OutcomeStatus status) {
    return new TranscriptionOutcome(status, "xin chào", 278.65, 0.82, 41.2, 10, 10, null, List.of());
  }

  @Test
  void transcribe_success_returns200WithOutcome() throws Exception {
    when(transcriptionService.transcribe(any(TranscriptionRequest.class)))
        .thenReturn(outcome(OutcomeStatus.SUCCESS));

    mockMvc
        .perform(post("/api/v1/transcriptions").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("SUCCESS"))
        .andExpect(jsonPath("$.transcript").value("xin chào"))
        .andExpect(jsonPath("$.chunksProcessed").value(10))
        .andExpect(jsonPath("$.chunksTotal").value(10));
  }

  @Test
  void transcribe_partial_returns200() throws Exception {
    when(transcriptionService.transcribe(any(TranscriptionRequest.class)))
        .thenReturn(outcome(OutcomeStatus.PARTIAL));

    mockMvc
        .perform(post("/api/v1/transcriptions").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("PARTIAL"));
  }

  @Test
  void transcribe_partial_reportsTimeRangeOfFailedChunk() throws Exception {
    List<ChunkResult> chunks =
        List.of(
            ChunkResult.ok(new ChunkWindow(0, 0, 30), "xin chào", 0.9),
            ChunkResult.failed(new ChunkWindow(1, 29, 45.5), "Transcription failed: decoder crashed"));
    when(transcriptionService.transcribe(any(TranscriptionRequest.class)))
        .thenReturn(
            new TranscriptionOutcome(
                OutcomeStatus.PARTIAL, "xin chào", 45.5, 0.9, 8.0, 2, 2, "1 of 2 chunks failed", chunks));

    mockMvc
        .perform(post("/api/v1/transcriptions").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.chunks.length()").value(2))
        .andExpect(jsonPath("$.chunks[1].index").value(1))
        .andExpect(jsonPath("$.chunks[1].start").value(29.0))
        .andExpect(jsonPath("$.chunks[1].end").value(45.5))
        .andExpect(jsonPath("$.chunks[1].duration").value(16.5))
        .andExpect(jsonPath("$.chunks[1].status").value("FAILED"))
        .andExpect(jsonPath("$.chunks[1].error").value("Transcription failed: decoder crashed"));
  }

  @Test
  void transcribe_timeout_returns504() throws Exception {
    when(transcriptionService.transcribe(any(TranscriptionRequest.class)))
        .thenReturn(outcome(OutcomeStatus.TIMEOUT));

    mockMvc
        .perform(post("/api/v1/transcriptions").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isGatewayTimeout())
        .andExpect(jsonPath("$.status").value("TIMEOUT"));
  }

  @Test
  void transcribe_failed_returns500() throws Exception {
    when(transcriptionService.transcribe(any(TranscriptionRequest.class)))
        .thenReturn(TranscriptionOutcome.failed("All chunks failed", 100.0, 3.0, 4, 4));

    mockMvc
        .perform(post("/api/v1/transcriptions").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("All chunks failed"));
  }

  @Test
  void transcribe_invalidChunkSettings_returns400() throws Exception {
    when(transcriptionService.transcribe(any(TranscriptionRequest.class)))
        .thenThrow(new ChunkingConfigurationException("Overlap (30.0s) must be less than chunk duration (30.0s)"));

    mockMvc
        .perform(
            post("/api/v1/transcriptions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"filePath\":\"/data/a.mp3\",\"chunkLengthSeconds\":30,\"overlapSeconds\":30}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value("INVALID_CONFIGURATION"));
  }

  @Test
  void transcribe_unusableFilePath_returns400() throws Exception {
    when(transcriptionService.transcribe(any(TranscriptionRequest.class)))
        .thenThrow(new InvalidPathException("/data/a\0.mp3", "Nul character not allowed"));

    mockMvc
        .perform(post("/api/v1/transcriptions").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value("INVALID_FILE_PATH"));
  }

  @Test
  void transcribe_missingFilePath_returns400() throws Exception {
    mockMvc
        .perform(post("/api/v1/transcriptions").contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value("INVALID_REQUEST"));
  }

  @Test
  void submitJob_returns202AndStartsRunner() throws Exception {
    mockMvc
        .perform(post("/api/v1/jobs").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").isNotEmpty());

    verify(jobRepository).save(any(TranscriptionJob.class));
    verify(jobRunner).runAsync(any(TranscriptionJob.class));
  }

  @Test
  void submitJob_invalidSettings_rejectedBeforeJobCreated() throws Exception {
    when(transcriptionService.toPipelineConfig(any(TranscriptionRequest.class)))
        .thenThrow(new ChunkingConfigurationException("bad overlap"));

    mockMvc
        .perform(post("/api/v1/jobs").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isBadRequest());

    verify(jobRunner, never()).runAsync(any());
  }

  @Test
  void submitJob_queueFull_returns503AndMarksJobFailed() throws Exception {
    doThrow(new TaskRejectedException("Executor did not accept task"))
        .when(jobRunner)
        .runAsync(any(TranscriptionJob.class));

    mockMvc
        .perform(post("/api/v1/jobs").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.errorCode").value("QUEUE_FULL"));

    ArgumentCaptor<TranscriptionJob> saved = ArgumentCaptor.forClass(TranscriptionJob.class);
    verify(jobRepository, times(2)).save(saved.capture());
    assertThat(saved.getValue().getStatus()).isEqualTo(Status.FAILED);
    assertThat(saved.getValue().getError()).contains("queue is full");
  }

  @Test
  void getJobStatus_unknown_returns404() throws Exception {
    when(jobRepository.findById("missing")).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/v1/jobs/missing")).andExpect(status().isNotFound());
  }

  @Test
  void getJobStatus_inProgress_reportsChunkCounts() throws Exception {
    TranscriptionJob job = new TranscriptionJob("job-1", TranscriptionRequest.of("/data/call.mp3", "vi"));
    job.setStatus(Status.PROCESSING);
    job.setProgress(4, 10);
    when(jobRepository.findById("job-1")).thenReturn(Optional.of(job));

    mockMvc
        .perform(get("/api/v1/jobs/job-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("PROCESSING"))
        .andExpect(jsonPath("$.chunksProcessed").value(4))
        .andExpect(jsonPath("$.chunksTotal").value(10));
  }

  @Test
  void getJobStatus_completed_includesChunkBreakdown() throws Exception {
    TranscriptionJob job = new TranscriptionJob("job-2", TranscriptionRequest.of("/data/call.mp3", "vi"));
    job.setStatus(Status.COMPLETED);
    job.setOutcome(
        new TranscriptionOutcome(
            OutcomeStatus.SUCCESS,
            "xin chào",
            25.0,
            0.9,
            2.0,
            1,
            1,
            null,
            List.of(ChunkResult.ok(new ChunkWindow(0, 0, 25), "xin chào", 0.9))));
    when(jobRepository.findById("job-2")).thenReturn(Optional.of(job));

    mockMvc
        .perform(get("/api/v1/jobs/job-2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.outcome.chunks[0].start").value(0.0))
        .andExpect(jsonPath("$.outcome.chunks[0].end").value(25.0))
        .andExpect(jsonPath("$.outcome.chunks[0].status").value("OK"));
  }

  @Test
  void engineInfo_returnsActiveBackend() throws Exception {
    when(transcriptionService.engineInfo())
        .thenReturn(new EngineInfoResponse("CLI", "SMALL", "ggml-small-q5_1.bin", 500, 8, 8, "vi"));

    mockMvc
        .perform(get("/api/v1/engine"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.backend").value("CLI"))
        .andExpect(jsonPath("$.modelFile").value("ggml-small-q5_1.bin"));
  }
}
