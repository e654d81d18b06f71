package com.scholary.audiobook.enhancer.rewrite;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audiobook.enhancer.config.EnhancementProperties.OpenAiProperties;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Rewrites the buffer with an OpenAI-compatible chat completions endpoint. */
public class OpenAiTextRewriter implements TextRewriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiTextRewriter.class);

  static final String SYSTEM_PROMPT =
      "You are an expert at optimizing academic text for text-to-speech conversion. "
          + "Make text more natural for spoken delivery while preserving technical accuracy.";

  private final OpenAiProperties properties;
  private final ObjectMapper objectMapper;
  private final HttpClient httpClient;

  public OpenAiTextRewriter(OpenAiProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.timeoutSeconds()))
            .build());
  }

  OpenAiTextRewriter(
      OpenAiProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient = httpClient;
    LOGGER.info(
        "Initialized OpenAI rewriter: baseUrl={}, model={}", properties.baseUrl(), properties.model());
  }

  @Override
  public RewriteResult rewrite(String content) {
    if (properties.apiKey() == null || properties.apiKey().isBlank()) {
      LOGGER.warn("OpenAI rewrite skipped: no API key configured");
      return RewriteResult.unchanged(content);
    }
    try {
      return RewriteResult.of(content, complete(content));
    } catch (IOException | RewriteException e) {
      LOGGER.warn("OpenAI rewrite failed, keeping original text: {}", e.getMessage());
      return RewriteResult.unchanged(content);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("OpenAI rewrite interrupted, keeping original text");
      return RewriteResult.unchanged(content);
    }
  }

  private String complete(String content) throws IOException, InterruptedException {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("model", properties.model());
    body.put(
        "messages",
        List.of(
            Map.of("role", "system", "content", SYSTEM_PROMPT),
            Map.of(
                "role",
                "user",
                "content",
                "Optimize this text for audiobook narration:\n\n" + content)));
    body.put("max_tokens", properties.maxTokens());

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/v1/chat/completions"))
            .timeout(Duration.ofSeconds(properties.timeoutSeconds()))
            .header("Content-Type", "application/json")
            .header("Authorization", "Bearer " + properties.apiKey())
            .POST(BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
            .build();

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() != 200) {
      throw new RewriteException(
          String.format("OpenAI returned status %d: %s", response.statusCode(), response.body()));
    }

    JsonNode message = objectMapper.readTree(response.body()).path("choices").path(0).path("message");
    JsonNode text = message.get("content");
    if (text == null || !text.isTextual()) {
      throw new RewriteException("OpenAI reply has no message content");
    }
    return text.asText();
  }

  @Override
  public String getProviderName() {
    return "openai";
  }
}
