package com.ospicorp.fewsjdbc.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * In-memory {@link CacheStore} with a TTL per entry and a size bound.
 */
public class CaffeineCacheStore implements CacheStore {

  private final Cache<String, Entry> cache;

  public CaffeineCacheStore(long maximumSize) {
    this(maximumSize, Ticker.systemTicker());
  }

  public CaffeineCacheStore(long maximumSize, Ticker ticker) {
    this.cache = Caffeine.newBuilder()
        .maximumSize(Math.max(1, maximumSize))
        .expireAfter(new EntryExpiry())
        .ticker(ticker)
        .build();
  }

  @Override
  public Optional<Object> get(String key) {
    Entry entry = cache.getIfPresent(key);
    return entry == null ? Optional.empty() : Optional.of(entry.value());
  }

  @Override
  public void set(String key, Object value, Duration ttl) {
    if (value == null) {
      throw new IllegalArgumentException("null values cannot be cached: " + key);
    }
    if (ttl != null && (ttl.isNegative() || ttl.isZero())) {
      throw new IllegalArgumentException("ttl must be positive: " + ttl);
    }
    cache.put(key, new Entry(value, ttl));
  }

  @Override
  public void removeIf(Predicate<String> keyFilter) {
    cache.asMap().keySet().removeIf(keyFilter);
  }

  long estimatedSize() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  private record Entry(Object value, Duration ttl) {
    long ttlNanos() {
      if (ttl == null) {
        return Long.MAX_VALUE;
      }
      try {
        return ttl.toNanos();
      } catch (ArithmeticException ex) {
        // longer than ~292 years
        return Long.MAX_VALUE;
      }
    }
  }

  private static final class EntryExpiry implements Expiry<String, Entry> {
    @Override
    public long expireAfterCreate(String key, Entry entry, long currentTime) {
      return entry.ttlNanos();
    }

    @Override
    public long expireAfterUpdate(String key, Entry entry, long currentTime,
        long currentDuration) {
      return entry.ttlNanos();
    }

    @Override
    public long expireAfterRead(String key, Entry entry, long currentTime,
        long currentDuration) {
      return currentDuration;
    }
  }
}
