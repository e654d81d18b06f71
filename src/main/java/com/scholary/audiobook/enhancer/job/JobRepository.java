package com.scholary.audiobook.enhancer.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory store for enhancement jobs.
 *
 * <p>Bounded in size and expiring after a fixed time, so finished jobs never accumulate. Jobs do
 * not survive a restart.
 */
@Repository
public class JobRepository {

  private final Cache<String, EnhancementJob> cache;

  public JobRepository(
      @Value("${jobstore.maxSize:1000}") int maxSize,
      @Value("${jobstore.expireAfterMinutes:60}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(EnhancementJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<EnhancementJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  public void delete(String jobId) {
    cache.invalidate(jobId);
  }
}
