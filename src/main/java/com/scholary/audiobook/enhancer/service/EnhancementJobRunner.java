package com.scholary.audiobook.enhancer.service;

import com.scholary.audiobook.enhancer.api.EnhancementResponse;
import com.scholary.audiobook.enhancer.api.JobStatusResponse.Status;
import com.scholary.audiobook.enhancer.job.EnhancementJob;
import com.scholary.audiobook.enhancer.job.JobRepository;
import com.scholary.audiobook.enhancer.logging.StructuredLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs enhancement jobs on the {@code taskExecutor} pool.
 *
 * <p>Lives in its own bean so the {@link Async} proxy is applied when the controller calls it.
 */
@Service
public class EnhancementJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(EnhancementJobRunner.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final EnhancementService enhancementService;
  private final JobRepository jobRepository;

  public EnhancementJobRunner(EnhancementService enhancementService, JobRepository jobRepository) {
    this.enhancementService = enhancementService;
    this.jobRepository = jobRepository;
  }

  @Async("taskExecutor")
  public void run(EnhancementJob job) {
    LOGGER.info("Starting async processing for job: {}", job.getJobId());

    try {
      job.setStatus(Status.PROCESSING);
      job.setProgress(10);
      jobRepository.save(job);
      STRUCTURED_LOGGER.logJobProgress(job.getJobId(), 10, "annotating");

      EnhancementResult result = enhancementService.enhance(job.getRequest().toTree());

      job.setResult(EnhancementResponse.from(result));
      job.setProgress(100);
      job.setStatus(Status.COMPLETED);
      jobRepository.save(job);
      STRUCTURED_LOGGER.logJobProgress(job.getJobId(), 100, "completed");

    } catch (RuntimeException e) {
      LOGGER.error("Async processing failed for job: {}", job.getJobId(), e);
      job.setError(e.getMessage());
      job.setStatus(Status.FAILED);
      jobRepository.save(job);
    }
  }
}
