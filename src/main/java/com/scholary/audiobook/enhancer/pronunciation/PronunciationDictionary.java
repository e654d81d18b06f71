package com.scholary.audiobook.enhancer.pronunciation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.scholary.audiobook.enhancer.config.EnhancementProperties.PronunciationProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered term-to-pronunciation table.
 *
 * <p>Built from the configured terminology domains, then the optional YAML dictionary file. A
 * later source overrides an earlier one for the same term but keeps its original position.
 */
public final class PronunciationDictionary {

  private static final Logger LOGGER = LoggerFactory.getLogger(PronunciationDictionary.class);

  private static final TypeReference<LinkedHashMap<String, String>> TERM_MAP =
      new TypeReference<>() {};

  private final Map<String, String> entries;

  private PronunciationDictionary(Map<String, String> entries) {
    this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
  }

  public static PronunciationDictionary of(Map<String, String> entries) {
    return new PronunciationDictionary(entries);
  }

  public static PronunciationDictionary empty() {
    return new PronunciationDictionary(Map.of());
  }

  /**
   * Load the dictionary from configuration.
   *
   * @throws IllegalStateException if the dictionary file exists but cannot be read
   */
  public static PronunciationDictionary load(
      PronunciationProperties properties, YAMLMapper yamlMapper) {
    Map<String, String> merged = new LinkedHashMap<>();
    properties.terminology().values().forEach(merged::putAll);

    String dictionaryFile = properties.dictionaryFile();
    if (dictionaryFile != null && !dictionaryFile.isBlank()) {
      Path path = Path.of(dictionaryFile);
      if (Files.isRegularFile(path)) {
        try {
          Map<String, String> external = yamlMapper.readValue(path.toFile(), TERM_MAP);
          if (external != null) {
            merged.putAll(external);
          }
        } catch (IOException e) {
          throw new IllegalStateException("Failed to read pronunciation dictionary: " + path, e);
        }
      } else {
        LOGGER.warn("Pronunciation dictionary file not found, skipping: {}", path);
      }
    }

    LOGGER.info("Loaded pronunciation dictionary: terms={}", merged.size());
    return new PronunciationDictionary(merged);
  }

  public Map<String, String> asMap() {
    return entries;
  }

  public int size() {
    return entries.size();
  }
}
