package com.scholary.audiobook.enhancer.api;

/**
 * Response for job status query.
 *
 * <p>Includes the result once the job is completed, or the error once it has failed.
 */
public record JobStatusResponse(
    String jobId, Status status, Integer progress, EnhancementResponse result, String error) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }
}
