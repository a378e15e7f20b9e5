package com.scholary.stt.job;

import com.scholary.stt.api.JobStatusResponse.Status;
import com.scholary.stt.logging.PipelineEventLogger;
import com.scholary.stt.pipeline.OutcomeStatus;
import com.scholary.stt.pipeline.TranscriptionOutcome;
import com.scholary.stt.service.TranscriptionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs submitted jobs on the job executor.
 *
 * <p>Lives in its own bean so the {@code @Async} proxy applies when the controller calls it.
 */
@Service
public class TranscriptionJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionJobRunner.class);

  private final TranscriptionService transcriptionService;
  private final JobRepository jobRepository;

  public TranscriptionJobRunner(
      TranscriptionService transcriptionService, JobRepository jobRepository) {
    this.transcriptionService = transcriptionService;
    this.jobRepository = jobRepository;
  }

  @Async("jobExecutor")
  public void runAsync(TranscriptionJob job) {
    run(job);
  }

  /** Process a job on the calling thread, recording progress and the outcome. */
  public void run(TranscriptionJob job) {
    PipelineEventLogger.setJobContext(job.getJobId());
    try {
      LOGGER.info("Starting job {}", job.getJobId());
      job.setStatus(Status.PROCESSING);
      jobRepository.save(job);

      TranscriptionOutcome outcome =
          transcriptionService.transcribe(job.getRequest(), job::setProgress);

      job.setOutcome(outcome);
      job.setProgress(outcome.chunksProcessed(), outcome.chunksTotal());
      if (outcome.status() == OutcomeStatus.SUCCESS || outcome.status() == OutcomeStatus.PARTIAL) {
        job.setStatus(Status.COMPLETED);
      } else {
        job.setStatus(Status.FAILED);
        job.setError(outcome.error());
      }
      jobRepository.save(job);
      LOGGER.info("Finished job {}: {}", job.getJobId(), outcome.status());
    } catch (RuntimeException e) {
      LOGGER.error("Job {} failed", job.getJobId(), e);
      job.setStatus(Status.FAILED);
      job.setError(e.getMessage());
      jobRepository.save(job);
    } finally {
      PipelineEventLogger.clearJobContext();
    }
  }
}
