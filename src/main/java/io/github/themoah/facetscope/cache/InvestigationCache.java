package io.github.themoah.facetscope.cache;

import io.github.themoah.facetscope.config.InvestigationConfig;
import io.github.themoah.facetscope.context.QueryContext;
import io.github.themoah.facetscope.metrics.InvestigationMetrics;
import io.github.themoah.facetscope.model.Contributor;
import io.github.themoah.facetscope.model.InvestigationResult;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Two-tier investigation cache: a single in-memory slot for the current session and
 * a durable, namespaced store with version stamping, TTL and bounded retention.
 */
public class InvestigationCache {

  private static final Logger log = LoggerFactory.getLogger(InvestigationCache.class);

  public static final String NAMESPACE = "anomaly_investigation_";

  /**
   * Bumped whenever the investigation algorithm changes so older entries are ignored.
   */
  public static final int CACHE_VERSION = 3;

  private final DurableStore store;
  private final Clock clock;
  private final long ttlMs;
  private final int maxEntries;
  private final int topN;
  private final InvestigationMetrics metrics;

  private MemoryEntry memory;

  public InvestigationCache(DurableStore store, InvestigationConfig config, Clock clock, InvestigationMetrics metrics) {
    this.store = Objects.requireNonNull(store, "store cannot be null");
    this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    this.ttlMs = config.cacheTtlMs();
    this.maxEntries = config.cacheMaxEntries();
    this.topN = config.cacheTopN();
  }

  public InvestigationCache(DurableStore store, InvestigationConfig config) {
    this(store, config, Clock.systemUTC(), InvestigationMetrics.noop());
  }

  // memory tier

  public Optional<MemoryEntry> memory() {
    return Optional.ofNullable(memory);
  }

  public void remember(MemoryEntry entry) {
    this.memory = entry;
  }

  public void clearMemory() {
    this.memory = null;
  }

  /**
   * True if the memory slot holds results for this key.
   */
  public boolean memoryMatches(String cacheKey) {
    return memory != null && memory.key().equals(cacheKey);
  }

  // durable tier

  /**
   * Loads a durable entry usable in the given context.
   * Unparsable entries are removed. Entries without a stored context are accepted as is.
   *
   * @param cacheKey key from the time and host filters
   * @param current the context being displayed now
   * @return the entry, or empty on miss, version mismatch, expiry or ineligible context
   */
  public Optional<CacheEntry> loadDurable(String cacheKey, QueryContext current) {
    String key = NAMESPACE + cacheKey;
    Optional<String> raw;
    try {
      raw = store.get(key);
    } catch (RuntimeException e) {
      log.warn("Failed to read cached investigation {}: {}", key, e.getMessage());
      return Optional.empty();
    }
    if (raw.isEmpty()) {
      log.debug("No cache found for key: {}", cacheKey);
      return Optional.empty();
    }

    CacheEntry entry;
    try {
      entry = CacheEntryCodec.decode(raw.get());
    } catch (RuntimeException e) {
      log.warn("Discarding corrupt cache entry {}: {}", key, e.getMessage());
      removeQuietly(key);
      return Optional.empty();
    }

    if (entry.version() != CACHE_VERSION) {
      log.debug("Cache version mismatch: {} vs {}", entry.version(), CACHE_VERSION);
      return Optional.empty();
    }
    long age = clock.millis() - entry.timestamp();
    if (age >= ttlMs) {
      log.debug("Cache expired for key {} (age {}ms)", cacheKey, age);
      return Optional.empty();
    }
    if (entry.isLegacy()) {
      log.debug("Cache eligible: old format (no context)");
      return Optional.of(entry);
    }
    if (!QueryContext.isEligible(current, entry.context())) {
      return Optional.empty();
    }
    log.debug("Cache loaded: {} contributors", entry.topContributors().size());
    return Optional.of(entry);
  }

  /**
   * Persists an investigation, keeping only the top contributors, then applies retention.
   *
   * @return the entry as written
   */
  public CacheEntry saveDurable(String cacheKey, List<InvestigationResult> results,
                                List<Contributor> topContributors, QueryContext context) {
    List<Contributor> top = topContributors.size() > topN ? topContributors.subList(0, topN) : topContributors;
    CacheEntry entry = new CacheEntry(results, top, context, CACHE_VERSION, clock.millis());
    String key = NAMESPACE + cacheKey;
    try {
      store.set(key, CacheEntryCodec.encode(entry));
      log.debug("Cached investigation {} with {} results, {} contributors", key, results.size(), top.size());
    } catch (RuntimeException e) {
      log.warn("Failed to cache investigation {}: {}", key, e.getMessage());
    }
    enforceRetention();
    return entry;
  }

  /**
   * Keeps the most recent entries of the namespace and removes the rest.
   * Entries whose timestamp cannot be read rank as oldest.
   *
   * @return number of entries removed
   */
  public int enforceRetention() {
    List<Map.Entry<String, Long>> entries = new ArrayList<>();
    try {
      for (String key : store.keys()) {
        if (key.startsWith(NAMESPACE)) {
          long timestamp = store.get(key).map(CacheEntryCodec::timestampOf).orElse(0L);
          entries.add(Map.entry(key, timestamp));
        }
      }
    } catch (RuntimeException e) {
      log.warn("Cache retention skipped: {}", e.getMessage());
      return 0;
    }

    if (entries.size() <= maxEntries) {
      return 0;
    }
    entries.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()));
    List<Map.Entry<String, Long>> evicted = entries.subList(maxEntries, entries.size());
    evicted.forEach(e -> removeQuietly(e.getKey()));
    log.debug("Cache retention removed {} entries", evicted.size());
    metrics.recordEvictions(evicted.size());
    return evicted.size();
  }

  /**
   * Removes every namespaced durable entry. Entries outside the namespace are untouched.
   *
   * @return number of entries removed
   */
  public int clearDurable() {
    int removed = 0;
    for (String key : store.keys()) {
      if (key.startsWith(NAMESPACE)) {
        store.remove(key);
        removed++;
      }
    }
    log.info("Cleared {} cached investigations", removed);
    return removed;
  }

  private void removeQuietly(String key) {
    try {
      store.remove(key);
    } catch (RuntimeException e) {
      log.warn("Failed to remove cache entry {}: {}", key, e.getMessage());
    }
  }
}
