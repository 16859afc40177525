package com.ospicorp.fewsjdbc.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Key/value store shared by all lookups. Only single-key reads and writes are atomic.
 */
public interface CacheStore {

  Optional<Object> get(String key);

  /**
   * @param ttl time to live, or {@code null} to keep the entry until the store evicts it
   */
  void set(String key, Object value, Duration ttl);

  void removeIf(Predicate<String> keyFilter);
}
