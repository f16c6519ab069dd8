package io.github.themoah.facetscope.cache;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable store kept in process memory. Entries live as long as the service.
 */
public class InMemoryDurableStore implements DurableStore {

  private final ConcurrentHashMap<String, String> entries = new ConcurrentHashMap<>();

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(entries.get(key));
  }

  @Override
  public void set(String key, String value) {
    entries.put(key, value);
  }

  @Override
  public Set<String> keys() {
    return Set.copyOf(entries.keySet());
  }

  @Override
  public void remove(String key) {
    entries.remove(key);
  }

  public int size() {
    return entries.size();
  }
}
