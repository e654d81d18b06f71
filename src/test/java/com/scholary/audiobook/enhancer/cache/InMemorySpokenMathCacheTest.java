package com.scholary.audiobook.enhancer.cache;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class InMemorySpokenMathCacheTest {

  @Test
  void get_shouldReturnStoredValue() {
    InMemorySpokenMathCache cache = new InMemorySpokenMathCache(10);
    String key = SpokenMathCache.generateKey("regex", false, "x");

    cache.put(key, "x");

    assertThat(cache.get(key)).contains("x");
    assertThat(cache.getStats()).startsWith("SpokenMathCache[size=1");
  }

  @Test
  void generateKey_shouldSeparateBackendsAndModes() {
    assertThat(SpokenMathCache.generateKey("regex", false, "x"))
        .isNotEqualTo(SpokenMathCache.generateKey("regex", true, "x"))
        .isNotEqualTo(SpokenMathCache.generateKey("structure-aware", false, "x"));
  }

  @Test
  void clear_shouldDropAllEntries() {
    InMemorySpokenMathCache cache = new InMemorySpokenMathCache(10);
    cache.put("k", "v");

    cache.clear();

    assertThat(cache.get("k")).isEmpty();
  }
}
