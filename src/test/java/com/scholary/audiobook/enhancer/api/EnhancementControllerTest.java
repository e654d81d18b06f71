package com.scholary.audiobook.enhancer.api;

import static org.mockito.ArgumentMatchers.any;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.audiobook.enhancer.annotation.AnnotationException;
import com.scholary.audiobook.enhancer.annotation.EnhancedText;
import com.scholary.audiobook.enhancer.annotation.VoiceRole;
import com.scholary.audiobook.enhancer.annotation.VoiceSpan;
import com.scholary.audiobook.enhancer.document.DocumentTree;
import com.scholary.audiobook.enhancer.job.EnhancementJob;
import com.scholary.audiobook.enhancer.job.JobRepository;
import com.scholary.audiobook.enhancer.service.EnhancedTextWriter;
import com.scholary.audiobook.enhancer.service.EnhancementJobRunner;
import com.scholary.audiobook.enhancer.service.EnhancementResult;
import com.scholary.audiobook.enhancer.service.EnhancementService;
import com.scholary.audiobook.enhancer.speech.ValidationReport;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(EnhancementController.class)
class EnhancementControllerTest {

  private static final String REQUEST =
      "{\"title\": \"Doc\", \"chapters\": [{\"depth\": 1, \"title\": \"Intro\", \"body\": \"Hi.\"}]}";

  @Autowired private MockMvc mockMvc;

  @MockBean private EnhancementService enhancementService;
  @MockBean private EnhancementJobRunner jobRunner;
  @MockBean private JobRepository jobRepository;
  @MockBean private EnhancedTextWriter writer;

  @Test
  void enhance_shouldReturnAnnotations() throws Exception {
    when(enhancementService.enhance(any(DocumentTree.class))).thenReturn(result());

    mockMvc
        .perform(post("/api/enhance").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.content").value("Intro\n\nHi.\n\n"))
        .andExpect(jsonPath("$.voiceSpans[0].role").value("MAIN_TITLE"))
        .andExpect(jsonPath("$.chapterBreaks[0]").value(0))
        .andExpect(jsonPath("$.offsetsExact").value(true))
        .andExpect(jsonPath("$.valid").value(true));
  }

  @Test
  void enhance_shouldRejectMissingDepth() throws Exception {
    mockMvc
        .perform(
            post("/api/enhance")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"chapters\": [{\"title\": \"No depth\"}]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value("InvalidRequest"));
  }

  @Test
  void enhance_shouldRejectNullHeadings() throws Exception {
    mockMvc
        .perform(
            post("/api/enhance")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"chapters\": [null]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value("InvalidRequest"));

    mockMvc
        .perform(
            post("/api/enhance")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"chapters\": [{\"depth\": 1, \"title\": \"A\", \"children\": [null]}]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value("InvalidRequest"));
  }

  @Test
  void enhance_shouldRejectMalformedJson() throws Exception {
    mockMvc
        .perform(post("/api/enhance").contentType(MediaType.APPLICATION_JSON).content("{oops"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.details").value("Request body is not valid JSON"));
  }

  @Test
  void enhance_shouldMapStructuralFailureToUnprocessable() throws Exception {
    when(enhancementService.enhance(any(DocumentTree.class)))
        .thenThrow(new AnnotationException("Cycle in document tree at heading 'Intro'"));

    mockMvc
        .perform(post("/api/enhance").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.errorCode").value("AnnotationException"))
        .andExpect(jsonPath("$.details").value("Cycle in document tree at heading 'Intro'"));
  }

  @Test
  void enhanceScript_shouldReturnPlainText() throws Exception {
    when(enhancementService.enhance(any(DocumentTree.class))).thenReturn(result());
    when(writer.writeScript(anyList())).thenReturn("=== Chapter 1: Intro ===\n");

    mockMvc
        .perform(
            post("/api/enhance/script").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
        .andExpect(content().string("=== Chapter 1: Intro ===\n"));
  }

  @Test
  void enhanceAsync_shouldAcceptAndStartJob() throws Exception {
    mockMvc
        .perform(
            post("/api/enhance/async").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").isNotEmpty())
        .andExpect(jsonPath("$.statusUrl").value(startsWith("/api/jobs/")));

    verify(jobRepository).save(any(EnhancementJob.class));
    verify(jobRunner).run(any(EnhancementJob.class));
  }

  @Test
  void getJobStatus_shouldReturnJob() throws Exception {
    when(jobRepository.findById("job-1")).thenReturn(Optional.of(new EnhancementJob("job-1", null)));

    mockMvc
        .perform(get("/api/jobs/job-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("PENDING"))
        .andExpect(jsonPath("$.progress").value(0));
  }

  @Test
  void getJobStatus_shouldReturnNotFound() throws Exception {
    when(jobRepository.findById("missing")).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/jobs/missing")).andExpect(status().isNotFound());
  }

  private static EnhancementResult result() {
    EnhancedText text =
        new EnhancedText(
            "Intro\n\nHi.\n\n",
            List.of(new VoiceSpan(0, 5, VoiceRole.MAIN_TITLE)),
            List.of(),
            List.of(0),
            List.of("Intro"),
            Map.of(),
            true);
    return new EnhancementResult("corr-1", text, ValidationReport.of(List.of()), List.of());
  }
}
