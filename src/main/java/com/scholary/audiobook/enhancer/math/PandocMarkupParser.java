package com.scholary.audiobook.enhancer.math;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MarkupParser} backed by the {@code pandoc} executable.
 *
 * <p>Runs {@code pandoc -f markdown -t json} and walks the resulting AST. Output goes to a temp
 * file rather than a pipe so a large AST can never block the child process.
 */
public class PandocMarkupParser implements MarkupParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(PandocMarkupParser.class);

  private final String command;
  private final Duration timeout;
  private final ObjectMapper objectMapper;

  private volatile Boolean available;

  public PandocMarkupParser(String command, Duration timeout, ObjectMapper objectMapper) {
    this.command = command;
    this.timeout = timeout;
    this.objectMapper = objectMapper;
  }

  @Override
  public boolean isAvailable() {
    Boolean cached = available;
    if (cached == null) {
      cached = probe();
      available = cached;
      LOGGER.info("Markup parser probe: command={}, available={}", command, cached);
    }
    return cached;
  }

  private boolean probe() {
    ProcessBuilder pb = new ProcessBuilder(command, "--version");
    pb.redirectErrorStream(true);
    pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
    try {
      Process process = pb.start();
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        return false;
      }
      return process.exitValue() == 0;
    } catch (IOException e) {
      LOGGER.debug("Markup parser not found: {}", e.getMessage());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  @Override
  public MarkupNode parse(String markup) throws MarkupParseException {
    Path output = null;
    Path errors = null;
    try {
      output = Files.createTempFile("markup-", ".json");
      errors = Files.createTempFile("markup-", ".err");

      ProcessBuilder pb = new ProcessBuilder(command, "-f", "markdown", "-t", "json");
      pb.redirectOutput(output.toFile());
      pb.redirectError(errors.toFile());

      Process process = pb.start();
      try (OutputStream stdin = process.getOutputStream()) {
        stdin.write(markup.getBytes(StandardCharsets.UTF_8));
      }

      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw new MarkupParseException(
            String.format("%s timed out after %ds", command, timeout.toSeconds()));
      }

      int exitCode = process.exitValue();
      if (exitCode != 0) {
        String error = Files.readString(errors, StandardCharsets.UTF_8).strip();
        throw new MarkupParseException(
            String.format("%s failed with exit code %d: %s", command, exitCode, error));
      }

      JsonNode root = objectMapper.readTree(output.toFile());
      if (root == null || !root.has("blocks")) {
        throw new MarkupParseException(command + " returned no document blocks");
      }
      return toNode(root.get("blocks"));

    } catch (IOException e) {
      throw new MarkupParseException("Failed to run " + command, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new MarkupParseException(command + " interrupted", e);
    } finally {
      deleteQuietly(output);
      deleteQuietly(errors);
    }
  }

  /**
   * Convert a pandoc AST fragment.
   *
   * <p>Elements are objects {@code {"t": type, "c": content}}. {@code Math} content is
   * {@code [{"t": "InlineMath"|"DisplayMath"}, latex]}.
   */
  static MarkupNode toNode(JsonNode json) {
    if (json == null || json.isNull()) {
      return MarkupNode.container(List.of());
    }
    if (json.isArray()) {
      List<MarkupNode> children = new ArrayList<>();
      for (JsonNode element : json) {
        children.add(toNode(element));
      }
      return MarkupNode.container(children);
    }
    if (json.isTextual()) {
      return MarkupNode.literal(json.asText());
    }
    if (!json.isObject() || !json.has("t")) {
      return MarkupNode.container(List.of());
    }

    String type = json.get("t").asText();
    JsonNode content = json.get("c");
    switch (type) {
      case "Math":
        boolean display = "DisplayMath".equals(content.get(0).path("t").asText());
        return MarkupNode.math(content.get(1).asText(), display);
      case "Str":
        return MarkupNode.literal(content.asText());
      case "Space":
      case "SoftBreak":
      case "LineBreak":
        return MarkupNode.literal(" ");
      default:
        return toNode(content);
    }
  }

  private static void deleteQuietly(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temp file: {}", path, e);
    }
  }
}
