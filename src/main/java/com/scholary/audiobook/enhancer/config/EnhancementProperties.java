package com.scholary.audiobook.enhancer.config;

import com.scholary.audiobook.enhancer.rewrite.ProcessingMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for document enhancement.
 *
 * <p>Every block may be omitted from {@code application.yml}; missing values fall back to the
 * defaults set in the compact constructors.
 */
@ConfigurationProperties(prefix = "enhancement")
@Validated
public record EnhancementProperties(
    ProcessingMode processingMode,
    @Valid MathProperties math,
    @Valid CitationProperties citations,
    @Valid PronunciationProperties pronunciation,
    @Valid SpeechProperties speech,
    @Valid ValidationProperties validation,
    @Valid SegmentationProperties segmentation,
    @Valid RewriteProperties rewrite) {

  public EnhancementProperties {
    if (processingMode == null) {
      processingMode = ProcessingMode.BASIC;
    }
    if (math == null) {
      math = new MathProperties(null, null, null, null, null);
    }
    if (citations == null) {
      citations = new CitationProperties(null);
    }
    if (pronunciation == null) {
      pronunciation = new PronunciationProperties(null, null);
    }
    if (speech == null) {
      speech = new SpeechProperties(null);
    }
    if (validation == null) {
      validation = new ValidationProperties(null, null);
    }
    if (segmentation == null) {
      segmentation = new SegmentationProperties(null, null);
    }
    if (rewrite == null) {
      rewrite = new RewriteProperties(null, null);
    }
  }

  /** All defaults. */
  public static EnhancementProperties defaults() {
    return new EnhancementProperties(null, null, null, null, null, null, null, null);
  }

  public record MathProperties(
      Boolean enabled,
      Boolean structureAware,
      @NotBlank String pandocCommand,
      @Positive Integer pandocTimeoutSeconds,
      @Positive Long cacheMaxSize) {

    public MathProperties {
      if (enabled == null) {
        enabled = true;
      }
      if (structureAware == null) {
        structureAware = true;
      }
      if (pandocCommand == null) {
        pandocCommand = "pandoc";
      }
      if (pandocTimeoutSeconds == null) {
        pandocTimeoutSeconds = 10;
      }
      if (cacheMaxSize == null) {
        cacheMaxSize = 10_000L;
      }
    }
  }

  public record CitationProperties(Boolean enabled) {

    public CitationProperties {
      if (enabled == null) {
        enabled = true;
      }
    }
  }

  /**
   * Pronunciation sources. {@code terminology} maps a domain name to its term table; domains are
   * merged in declaration order and the dictionary file is merged last.
   */
  public record PronunciationProperties(
      Map<String, Map<String, String>> terminology, String dictionaryFile) {

    public PronunciationProperties {
      terminology = terminology == null ? Map.of() : new LinkedHashMap<>(terminology);
    }
  }

  public record SpeechProperties(@Positive Integer longSentenceThreshold) {

    public SpeechProperties {
      if (longSentenceThreshold == null) {
        longSentenceThreshold = 200;
      }
    }
  }

  public record ValidationProperties(
      @Positive Integer maxSentenceLength, @Positive Integer minContentLength) {

    public ValidationProperties {
      if (maxSentenceLength == null) {
        maxSentenceLength = 300;
      }
      if (minContentLength == null) {
        minContentLength = 50;
      }
    }
  }

  public record SegmentationProperties(
      @NotBlank String fallbackTitle, Boolean failOnStraddlingSpan) {

    public SegmentationProperties {
      if (fallbackTitle == null) {
        fallbackTitle = "Chapter 1";
      }
      if (failOnStraddlingSpan == null) {
        failOnStraddlingSpan = false;
      }
    }
  }

  public record RewriteProperties(@Valid OllamaProperties ollama, @Valid OpenAiProperties openai) {

    public RewriteProperties {
      if (ollama == null) {
        ollama = new OllamaProperties(null, null, null, null);
      }
      if (openai == null) {
        openai = new OpenAiProperties(null, null, null, null, null, null);
      }
    }
  }

  public record OllamaProperties(
      Boolean enabled,
      @NotBlank String baseUrl,
      @NotBlank String model,
      @Positive Integer timeoutSeconds) {

    public OllamaProperties {
      if (enabled == null) {
        enabled = false;
      }
      if (baseUrl == null) {
        baseUrl = "http://localhost:11434";
      }
      if (model == null) {
        model = "llama2:7b";
      }
      if (timeoutSeconds == null) {
        timeoutSeconds = 30;
      }
    }
  }

  /** The API key is never logged. */
  public record OpenAiProperties(
      Boolean enabled,
      @NotBlank String baseUrl,
      @NotBlank String model,
      @Positive Integer maxTokens,
      String apiKey,
      @Positive Integer timeoutSeconds) {

    public OpenAiProperties {
      if (enabled == null) {
        enabled = false;
      }
      if (baseUrl == null) {
        baseUrl = "https://api.openai.com";
      }
      if (model == null) {
        model = "gpt-3.5-turbo";
      }
      if (maxTokens == null) {
        maxTokens = 2000;
      }
      if (timeoutSeconds == null) {
        timeoutSeconds = 30;
      }
    }

    @Override
    public String toString() {
      return "OpenAiProperties[enabled=" + enabled + ", baseUrl=" + baseUrl + ", model=" + model
          + "]";
    }
  }
}
