package com.scholary.audiobook.enhancer.api;

/** Response for an async enhancement request: the job id and where to poll it. */
public record AsyncJobResponse(String jobId, String statusUrl) {}
