package com.scholary.stt.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for transcription jobs.
 *
 * <p>Uses a Caffeine cache so finished jobs are evicted by size and age instead of piling up.
 */
@Repository
public class JobRepository {

  private final Cache<String, TranscriptionJob> cache;

  public JobRepository(
      @Value("${jobstore.max-size}") int maxSize,
      @Value("${jobstore.expire-after-minutes}") int expireAfterMinutes) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(TranscriptionJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<TranscriptionJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }
}
