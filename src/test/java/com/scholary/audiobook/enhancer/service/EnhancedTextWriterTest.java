package com.scholary.audiobook.enhancer.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audiobook.enhancer.annotation.EnhancedText;
import com.scholary.audiobook.enhancer.annotation.PauseMarker;
import com.scholary.audiobook.enhancer.annotation.VoiceRole;
import com.scholary.audiobook.enhancer.annotation.VoiceSpan;
import com.scholary.audiobook.enhancer.segment.ChapterSegment;
import com.scholary.audiobook.enhancer.segment.VoiceSegmenter;
import com.scholary.audiobook.enhancer.speech.SpeechTextCleaner;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EnhancedTextWriterTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final EnhancedTextWriter writer =
      new EnhancedTextWriter(objectMapper, new VoiceSegmenter(new SpeechTextCleaner()));

  @Test
  void writeScript_shouldListChaptersWithVoicesAndPauses() {
    String content = "Intro\n\nHello [EMPHASIS] world [/EMPHASIS].\n\n";
    ChapterSegment chapter =
        new ChapterSegment(
            0,
            "Intro",
            content,
            0,
            content.length(),
            List.of(new VoiceSpan(0, 5, VoiceRole.MAIN_TITLE)),
            List.of(new PauseMarker(7, 2.5)));

    String script = writer.writeScript(List.of(chapter));

    assertThat(script)
        .isEqualTo(
            "=== Chapter 1: Intro ===\n"
                + "[main_title_voice +2.0s/+1.5s] Intro\n"
                + "[main_narrator] Hello world.\n"
                + "\n");
  }

  @Test
  void writeJson_shouldExportBufferAndAnnotations() throws Exception {
    EnhancedText text =
        new EnhancedText(
            "Intro\n\n",
            List.of(new VoiceSpan(0, 5, VoiceRole.MAIN_TITLE)),
            List.of(new PauseMarker(7, 2.5)),
            List.of(0),
            List.of("Intro"),
            Map.of("ANOVA", "ah-NO-vah"),
            true);

    JsonNode json = objectMapper.readTree(writer.writeJson(text));

    assertThat(json.get("content").asText()).isEqualTo("Intro\n\n");
    assertThat(json.get("offsetsExact").asBoolean()).isTrue();
    assertThat(json.get("voiceSpans").get(0).get("role").asText()).isEqualTo("MAIN_TITLE");
    assertThat(json.get("pauseMarkers").get(0).get("durationSeconds").asDouble()).isEqualTo(2.5);
    assertThat(json.get("pronunciationGuide").get("ANOVA").asText()).isEqualTo("ah-NO-vah");
  }
}
