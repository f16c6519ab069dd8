package io.github.themoah.facetscope.config;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tuning knobs for anomaly investigations and their cache.
 *
 * @param highlightTopN number of dimension values to highlight
 * @param cacheTopN number of top contributors persisted with a durable entry
 * @param facetResultLimit contributors kept per facet
 * @param minAnomalyRate minimum category requests per minute inside the window
 * @param significanceThreshold minimum change in percentage points
 * @param cacheTtlMs durable entry time to live
 * @param cacheMaxEntries durable entries kept by retention
 * @param cacheDir directory of the file-backed durable store, null for in-memory
 */
public record InvestigationConfig(
  int highlightTopN,
  int cacheTopN,
  int facetResultLimit,
  double minAnomalyRate,
  double significanceThreshold,
  long cacheTtlMs,
  int cacheMaxEntries,
  String cacheDir
) {

  private static final Logger log = LoggerFactory.getLogger(InvestigationConfig.class);

  public static final int DEFAULT_HIGHLIGHT_TOP_N = 3;
  public static final int DEFAULT_CACHE_TOP_N = 30;
  public static final int DEFAULT_FACET_RESULT_LIMIT = 5;
  public static final double DEFAULT_MIN_ANOMALY_RATE = 0.5;
  public static final double DEFAULT_SIGNIFICANCE_THRESHOLD = 5.0;
  public static final long DEFAULT_CACHE_TTL_MS = 60 * 60 * 1000L;
  public static final int DEFAULT_CACHE_MAX_ENTRIES = 10;

  public static InvestigationConfig defaults() {
    return new InvestigationConfig(
      DEFAULT_HIGHLIGHT_TOP_N,
      DEFAULT_CACHE_TOP_N,
      DEFAULT_FACET_RESULT_LIMIT,
      DEFAULT_MIN_ANOMALY_RATE,
      DEFAULT_SIGNIFICANCE_THRESHOLD,
      DEFAULT_CACHE_TTL_MS,
      DEFAULT_CACHE_MAX_ENTRIES,
      null
    );
  }

  public boolean useFileStore() {
    return cacheDir != null && !cacheDir.isBlank();
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>INVESTIGATION_HIGHLIGHT_TOP_N - Highlight budget (default: 3)</li>
   *   <li>INVESTIGATION_CACHE_TOP_N - Contributors kept in durable entries (default: 30)</li>
   *   <li>INVESTIGATION_CACHE_TTL_MS - Durable entry TTL (default: 1 hour)</li>
   *   <li>INVESTIGATION_CACHE_MAX_ENTRIES - Durable entries kept (default: 10)</li>
   *   <li>INVESTIGATION_CACHE_DIR - Directory for file-backed entries (default: in-memory)</li>
   * </ul>
   */
  public static InvestigationConfig fromEnvironment() {
    return fromMap(System.getenv());
  }

  static InvestigationConfig fromMap(Map<String, String> env) {
    int highlightTopN = EnvValues.getInt(env, "INVESTIGATION_HIGHLIGHT_TOP_N", DEFAULT_HIGHLIGHT_TOP_N);
    int cacheTopN = EnvValues.getInt(env, "INVESTIGATION_CACHE_TOP_N", DEFAULT_CACHE_TOP_N);
    long ttlMs = EnvValues.getLong(env, "INVESTIGATION_CACHE_TTL_MS", DEFAULT_CACHE_TTL_MS);
    int maxEntries = EnvValues.getInt(env, "INVESTIGATION_CACHE_MAX_ENTRIES", DEFAULT_CACHE_MAX_ENTRIES);
    String cacheDir = EnvValues.getString(env, "INVESTIGATION_CACHE_DIR", null);

    if (highlightTopN < 1) {
      log.warn("INVESTIGATION_HIGHLIGHT_TOP_N must be >= 1, using default: {}", DEFAULT_HIGHLIGHT_TOP_N);
      highlightTopN = DEFAULT_HIGHLIGHT_TOP_N;
    }
    if (cacheTopN < highlightTopN) {
      log.warn("INVESTIGATION_CACHE_TOP_N must be >= highlight budget, using default: {}", DEFAULT_CACHE_TOP_N);
      cacheTopN = DEFAULT_CACHE_TOP_N;
    }
    if (maxEntries < 1) {
      log.warn("INVESTIGATION_CACHE_MAX_ENTRIES must be >= 1, using default: {}", DEFAULT_CACHE_MAX_ENTRIES);
      maxEntries = DEFAULT_CACHE_MAX_ENTRIES;
    }

    InvestigationConfig config = new InvestigationConfig(
      highlightTopN,
      cacheTopN,
      DEFAULT_FACET_RESULT_LIMIT,
      DEFAULT_MIN_ANOMALY_RATE,
      DEFAULT_SIGNIFICANCE_THRESHOLD,
      ttlMs,
      maxEntries,
      cacheDir
    );
    log.info("Investigation config: highlightTopN={}, cacheTopN={}, cacheTtlMs={}, cacheMaxEntries={}, cacheDir={}",
      highlightTopN, cacheTopN, ttlMs, maxEntries, cacheDir == null ? "<memory>" : cacheDir);
    return config;
  }
}
