package com.scholary.stt.api;

import com.scholary.stt.api.JobStatusResponse.Status;
import com.scholary.stt.job.JobRepository;
import com.scholary.stt.job.TranscriptionJob;
import com.scholary.stt.job.TranscriptionJobRunner;
import com.scholary.stt.pipeline.TranscriptionOutcome;
import com.scholary.stt.service.TranscriptionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for transcription.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Synchronous transcription of a local file
 *   <li>Asynchronous jobs with chunk-level progress polling
 *   <li>Engine diagnostics
 * </ul>
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Transcription", description = "Chunked audio transcription API")
public class TranscriptionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionController.class);

  private final TranscriptionService transcriptionService;
  private final TranscriptionJobRunner jobRunner;
  private final JobRepository jobRepository;

  public TranscriptionController(
      TranscriptionService transcriptionService,
      TranscriptionJobRunner jobRunner,
      JobRepository jobRepository) {
    this.transcriptionService = transcriptionService;
    this.jobRunner = jobRunner;
    this.jobRepository = jobRepository;
  }

  /**
   * Transcribe and wait for the outcome.
   *
   * <p>Success and partial outcomes return 200; a timeout returns 504 and a failure 500, both with
   * the outcome as body.
   */
  @PostMapping("/transcriptions")
  @Operation(
      summary = "Transcribe a local file",
      description = "Run the chunked pipeline synchronously and return the outcome")
  public ResponseEntity<TranscriptionOutcome> transcribe(
      @Valid @RequestBody TranscriptionRequest request) {
    TranscriptionOutcome outcome = transcriptionService.transcribe(request);
    return ResponseEntity.status(httpStatusFor(outcome)).body(outcome);
  }

  /** Start asynchronous transcription job. */
  @PostMapping("/jobs")
  @Operation(
      summary = "Start transcription job",
      description = "Start asynchronous transcription job and return job ID for status polling")
  public ResponseEntity<AsyncJobResponse> submitJob(
      @Valid @RequestBody TranscriptionRequest request) {
    // Reject bad settings now rather than in a failed job.
    transcriptionService.sourcePath(request);
    transcriptionService.toPipelineConfig(request);

    String jobId = UUID.randomUUID().toString();
    TranscriptionJob job = new TranscriptionJob(jobId, request);
    jobRepository.save(job);
    LOGGER.info("Created async transcription job: {}", jobId);

    try {
      jobRunner.runAsync(job);
    } catch (TaskRejectedException e) {
      LOGGER.warn("Job queue full, rejecting job {}", jobId);
      job.setStatus(Status.FAILED);
      job.setError("Rejected: job queue is full");
      jobRepository.save(job);
      throw e;
    }
    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId, "/api/v1/jobs/" + jobId));
  }

  /** Get job status. */
  @GetMapping("/jobs/{id}")
  @Operation(
      summary = "Get job status",
      description = "Check the status and chunk progress of an async transcription job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            job ->
                ResponseEntity.ok(
                    new JobStatusResponse(
                        job.getJobId(),
                        job.getStatus(),
                        job.getChunksProcessed(),
                        job.getChunksTotal(),
                        job.getOutcome(),
                        job.getError())))
        .orElse(ResponseEntity.notFound().build());
  }

  @GetMapping("/engine")
  @Operation(summary = "Engine info", description = "Active engine backend, model and threads")
  public EngineInfoResponse engineInfo() {
    return transcriptionService.engineInfo();
  }

  static HttpStatus httpStatusFor(TranscriptionOutcome outcome) {
    return switch (outcome.status()) {
      case SUCCESS, PARTIAL -> HttpStatus.OK;
      case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
      case FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
    };
  }
}
