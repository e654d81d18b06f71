package com.scholary.audiobook.enhancer.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Caffeine-backed {@link SpokenMathCache} bounded by entry count. */
public class InMemorySpokenMathCache implements SpokenMathCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemorySpokenMathCache.class);

  private final Cache<String, String> cache;

  public InMemorySpokenMathCache(long maxSize) {
    this.cache = Caffeine.newBuilder().maximumSize(maxSize).recordStats().build();
    LOGGER.info("Initialized spoken math cache: maxSize={}", maxSize);
  }

  @Override
  public void put(String cacheKey, String spoken) {
    cache.put(cacheKey, spoken);
  }

  @Override
  public Optional<String> get(String cacheKey) {
    String spoken = cache.getIfPresent(cacheKey);
    if (spoken != null) {
      LOGGER.debug("Cache hit: key={}", cacheKey);
    }
    return Optional.ofNullable(spoken);
  }

  @Override
  public void clear() {
    cache.invalidateAll();
  }

  public String getStats() {
    var stats = cache.stats();
    return String.format(
        "SpokenMathCache[size=%d, hitRate=%.2f%%, evictions=%d]",
        cache.estimatedSize(), stats.hitRate() * 100, stats.evictionCount());
  }
}
