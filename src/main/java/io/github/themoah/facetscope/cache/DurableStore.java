package io.github.themoah.facetscope.cache;

import java.util.Optional;
import java.util.Set;

/**
 * Opaque string key-value storage that survives across sessions.
 * Implementations may throw unchecked exceptions on I/O failure.
 */
public interface DurableStore {

  Optional<String> get(String key);

  void set(String key, String value);

  /**
   * All keys currently stored, regardless of namespace.
   */
  Set<String> keys();

  void remove(String key);
}
