package com.scholary.audiobook.enhancer.api;

import com.scholary.audiobook.enhancer.job.EnhancementJob;
import com.scholary.audiobook.enhancer.job.JobRepository;
import com.scholary.audiobook.enhancer.service.EnhancedTextWriter;
import com.scholary.audiobook.enhancer.service.EnhancementJobRunner;
import com.scholary.audiobook.enhancer.service.EnhancementResult;
import com.scholary.audiobook.enhancer.service.EnhancementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for document enhancement.
 *
 * <ul>
 *   <li>Synchronous enhancement, as JSON or as a narration script
 *   <li>Asynchronous enhancement (returns a job id immediately)
 *   <li>Job status polling
 * </ul>
 */
@RestController
@Tag(name = "Enhancement", description = "Speech-ready text for academic documents")
public class EnhancementController {

  private static final Logger LOGGER = LoggerFactory.getLogger(EnhancementController.class);

  private final EnhancementService enhancementService;
  private final EnhancementJobRunner jobRunner;
  private final JobRepository jobRepository;
  private final EnhancedTextWriter writer;

  public EnhancementController(
      EnhancementService enhancementService,
      EnhancementJobRunner jobRunner,
      JobRepository jobRepository,
      EnhancedTextWriter writer) {
    this.enhancementService = enhancementService;
    this.jobRunner = jobRunner;
    this.jobRepository = jobRepository;
    this.writer = writer;
  }

  @PostMapping("/api/enhance")
  @Operation(
      summary = "Enhance document",
      description = "Build the annotated speech buffer, validation report and chapters")
  public ResponseEntity<EnhancementResponse> enhance(
      @Valid @RequestBody EnhancementRequest request) {
    EnhancementResult result = enhancementService.enhance(request.toTree());
    return ResponseEntity.ok(EnhancementResponse.from(result));
  }

  @PostMapping(value = "/api/enhance/script", produces = MediaType.TEXT_PLAIN_VALUE)
  @Operation(
      summary = "Enhance document as script",
      description = "Return the chapter-by-chapter narration plan as plain text")
  public ResponseEntity<String> enhanceScript(@Valid @RequestBody EnhancementRequest request) {
    EnhancementResult result = enhancementService.enhance(request.toTree());
    return ResponseEntity.ok()
        .contentType(MediaType.TEXT_PLAIN)
        .body(writer.writeScript(result.chapters()));
  }

  @PostMapping("/api/enhance/async")
  @Operation(
      summary = "Start enhancement",
      description = "Start an asynchronous enhancement job and return its id for polling")
  public ResponseEntity<AsyncJobResponse> enhanceAsync(
      @Valid @RequestBody EnhancementRequest request) {
    String jobId = UUID.randomUUID().toString();
    EnhancementJob job = new EnhancementJob(jobId, request);
    jobRepository.save(job);
    LOGGER.info("Created async enhancement job: {}", jobId);

    jobRunner.run(job);

    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId, "/api/jobs/" + jobId));
  }

  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of an enhancement job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            job ->
                ResponseEntity.ok(
                    new JobStatusResponse(
                        job.getJobId(),
                        job.getStatus(),
                        job.getProgress(),
                        job.getResult(),
                        job.getError())))
        .orElse(ResponseEntity.notFound().build());
  }
}
