package com.scholary.audiobook.enhancer.rewrite;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audiobook.enhancer.config.EnhancementProperties.OllamaProperties;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites the buffer with a local Ollama model via {@code POST /api/generate}.
 *
 * <p>The request is non-streaming, so the reply is one JSON object whose {@code response} field
 * holds the whole rewritten text.
 */
public class OllamaTextRewriter implements TextRewriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(OllamaTextRewriter.class);

  static final String PROMPT_TEMPLATE =
      "Please optimize the following academic text for text-to-speech conversion.\n"
          + "Make it more natural for spoken delivery while preserving all technical accuracy.\n"
          + "Add natural pauses and improve flow for audio consumption.\n\n"
          + "Text to optimize:\n%s\n\nOptimized text:\n";

  private final OllamaProperties properties;
  private final ObjectMapper objectMapper;
  private final HttpClient httpClient;

  public OllamaTextRewriter(OllamaProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.timeoutSeconds()))
            .build());
  }

  OllamaTextRewriter(
      OllamaProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient = httpClient;
    LOGGER.info(
        "Initialized Ollama rewriter: baseUrl={}, model={}", properties.baseUrl(), properties.model());
  }

  @Override
  public RewriteResult rewrite(String content) {
    try {
      return RewriteResult.of(content, generate(content));
    } catch (IOException | RewriteException e) {
      LOGGER.warn("Ollama rewrite failed, keeping original text: {}", e.getMessage());
      return RewriteResult.unchanged(content);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Ollama rewrite interrupted, keeping original text");
      return RewriteResult.unchanged(content);
    }
  }

  private String generate(String content) throws IOException, InterruptedException {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("model", properties.model());
    body.put("prompt", String.format(PROMPT_TEMPLATE, content));
    body.put("stream", false);

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/api/generate"))
            .timeout(Duration.ofSeconds(properties.timeoutSeconds()))
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
            .build();

    LOGGER.debug("Sending rewrite request to {}", request.uri());
    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() != 200) {
      throw new RewriteException(
          String.format("Ollama returned status %d: %s", response.statusCode(), response.body()));
    }

    JsonNode reply = objectMapper.readTree(response.body());
    JsonNode text = reply.get("response");
    if (text == null || !text.isTextual()) {
      throw new RewriteException("Ollama reply has no response field");
    }
    return text.asText();
  }

  @Override
  public String getProviderName() {
    return "ollama";
  }
}
