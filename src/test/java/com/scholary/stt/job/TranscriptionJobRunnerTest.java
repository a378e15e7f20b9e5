package com.scholary.stt.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.scholary.stt.api.JobStatusResponse.Status;
import com.scholary.stt.api.TranscriptionRequest;
import com.scholary.stt.pipeline.ChunkProgressListener;
import com.scholary.stt.pipeline.OutcomeStatus;
import com.scholary.stt.pipeline.TranscriptionOutcome;
import com.scholary.stt.service.TranscriptionService;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

@ExtendWith(MockitoExtension.class)
class TranscriptionJobRunnerTest {

  @Mock private TranscriptionService transcriptionService;

  private JobRepository jobRepository;
  private TranscriptionJobRunner runner;
  private TranscriptionJob job;

  @BeforeEach
  void setUp() {
    jobRepository = new JobRepository(10, 5);
    runner = new TranscriptionJobRunner(transcriptionService, jobRepository);
    job = new TranscriptionJob("job-1", TranscriptionRequest.of("/data/call.mp3", "vi"));
    jobRepository.save(job);
  }

  @Test
  void run_partialOutcome_completesJobAndTracksProgress() {
    when(transcriptionService.transcribe(eq(job.getRequest()), any(ChunkProgressListener.class)))
        .thenAnswer(
            invocation -> {
              ChunkProgressListener listener = invocation.getArgument(1);
              listener.onChunkProcessed(1, 2);
              assertThat(jobRepository.findById("job-1").orElseThrow().getChunksProcessed())
                  .isEqualTo(1);
              listener.onChunkProcessed(2, 2);
              return new TranscriptionOutcome(
                  OutcomeStatus.PARTIAL, "hello", 45.0, 0.9, 3.0, 2, 2, "1 of 2 chunks failed", List.of());
            });

    runner.run(job);

    TranscriptionJob stored = jobRepository.findById("job-1").orElseThrow();
    assertThat(stored.getStatus()).isEqualTo(Status.COMPLETED);
    assertThat(stored.getChunksProcessed()).isEqualTo(2);
    assertThat(stored.getOutcome().transcript()).isEqualTo("hello");
    assertThat(MDC.get("jobId")).isNull();
  }

  @Test
  void run_timeoutOutcome_marksJobFailed() {
    when(transcriptionService.transcribe(eq(job.getRequest()), any(ChunkProgressListener.class)))
        .thenReturn(
            new TranscriptionOutcome(
                OutcomeStatus.TIMEOUT,
                "partial text",
                900.0,
                0.8,
                1350.0,
                12,
                31,
                "Timed out after 1350.0s",
                List.of()));

    runner.run(job);

    assertThat(job.getStatus()).isEqualTo(Status.FAILED);
    assertThat(job.getError()).contains("Timed out");
    assertThat(job.getOutcome().chunksTotal()).isEqualTo(31);
  }

  @Test
  void run_unexpectedException_marksJobFailed() {
    when(transcriptionService.transcribe(eq(job.getRequest()), any(ChunkProgressListener.class)))
        .thenThrow(new IllegalStateException("boom"));

    runner.run(job);

    assertThat(job.getStatus()).isEqualTo(Status.FAILED);
    assertThat(job.getError()).isEqualTo("boom");
  }
}
