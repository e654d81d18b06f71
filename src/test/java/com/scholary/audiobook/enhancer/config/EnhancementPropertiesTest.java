package com.scholary.audiobook.enhancer.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.audiobook.enhancer.rewrite.ProcessingMode;
import org.junit.jupiter.api.Test;

class EnhancementPropertiesTest {

  @Test
  void defaults_shouldFillEveryBlock() {
    EnhancementProperties properties = EnhancementProperties.defaults();

    assertThat(properties.processingMode()).isEqualTo(ProcessingMode.BASIC);
    assertThat(properties.math().enabled()).isTrue();
    assertThat(properties.math().structureAware()).isTrue();
    assertThat(properties.math().pandocCommand()).isEqualTo("pandoc");
    assertThat(properties.citations().enabled()).isTrue();
    assertThat(properties.pronunciation().terminology()).isEmpty();
    assertThat(properties.speech().longSentenceThreshold()).isEqualTo(200);
    assertThat(properties.validation().maxSentenceLength()).isEqualTo(300);
    assertThat(properties.validation().minContentLength()).isEqualTo(50);
    assertThat(properties.segmentation().fallbackTitle()).isEqualTo("Chapter 1");
    assertThat(properties.segmentation().failOnStraddlingSpan()).isFalse();
    assertThat(properties.rewrite().ollama().enabled()).isFalse();
    assertThat(properties.rewrite().ollama().baseUrl()).isEqualTo("http://localhost:11434");
    assertThat(properties.rewrite().openai().model()).isEqualTo("gpt-3.5-turbo");
  }
}
