package com.scholary.audiobook.enhancer.job;

import com.scholary.audiobook.enhancer.api.EnhancementRequest;
import com.scholary.audiobook.enhancer.api.EnhancementResponse;
import com.scholary.audiobook.enhancer.api.JobStatusResponse.Status;

/**
 * An async enhancement job.
 *
 * <p>Tracks the job's state, progress and result. Stored in memory in {@link JobRepository}.
 */
public class EnhancementJob {

  private final String jobId;
  private final EnhancementRequest request;

  private volatile Status status;
  private volatile Integer progress; // 0-100
  private volatile EnhancementResponse result;
  private volatile String error;

  public EnhancementJob(String jobId, EnhancementRequest request) {
    this.jobId = jobId;
    this.request = request;
    this.status = Status.PENDING;
    this.progress = 0;
  }

  public String getJobId() {
    return jobId;
  }

  public EnhancementRequest getRequest() {
    return request;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public Integer getProgress() {
    return progress;
  }

  public void setProgress(Integer progress) {
    this.progress = progress;
  }

  public EnhancementResponse getResult() {
    return result;
  }

  public void setResult(EnhancementResponse result) {
    this.result = result;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
