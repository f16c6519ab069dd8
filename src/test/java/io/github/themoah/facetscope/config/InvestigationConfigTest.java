package io.github.themoah.facetscope.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for InvestigationConfig.
 */
public class InvestigationConfigTest {

  @Test
  void fromMap_defaults() {
    InvestigationConfig config = InvestigationConfig.fromMap(Map.of());

    assertEquals(InvestigationConfig.defaults(), config);
    assertEquals(3, config.highlightTopN());
    assertEquals(30, config.cacheTopN());
    assertEquals(3_600_000L, config.cacheTtlMs());
    assertEquals(10, config.cacheMaxEntries());
    assertFalse(config.useFileStore());
  }

  @Test
  void fromMap_overrides() {
    InvestigationConfig config = InvestigationConfig.fromMap(Map.of(
      "INVESTIGATION_HIGHLIGHT_TOP_N", "5",
      "INVESTIGATION_CACHE_TOP_N", "50",
      "INVESTIGATION_CACHE_TTL_MS", "60000",
      "INVESTIGATION_CACHE_MAX_ENTRIES", "20",
      "INVESTIGATION_CACHE_DIR", "/var/lib/facetscope"));

    assertEquals(5, config.highlightTopN());
    assertEquals(50, config.cacheTopN());
    assertEquals(60_000L, config.cacheTtlMs());
    assertEquals(20, config.cacheMaxEntries());
    assertTrue(config.useFileStore());
  }

  @Test
  void fromMap_invalidValuesFallBack() {
    InvestigationConfig config = InvestigationConfig.fromMap(Map.of(
      "INVESTIGATION_HIGHLIGHT_TOP_N", "0",
      "INVESTIGATION_CACHE_TOP_N", "abc",
      "INVESTIGATION_CACHE_MAX_ENTRIES", "-1"));

    assertEquals(InvestigationConfig.DEFAULT_HIGHLIGHT_TOP_N, config.highlightTopN());
    assertEquals(InvestigationConfig.DEFAULT_CACHE_TOP_N, config.cacheTopN());
    assertEquals(InvestigationConfig.DEFAULT_CACHE_MAX_ENTRIES, config.cacheMaxEntries());
  }

  @Test
  void fromMap_cacheTopNBelowBudgetFallsBack() {
    InvestigationConfig config = InvestigationConfig.fromMap(Map.of(
      "INVESTIGATION_HIGHLIGHT_TOP_N", "5",
      "INVESTIGATION_CACHE_TOP_N", "2"));

    assertEquals(InvestigationConfig.DEFAULT_CACHE_TOP_N, config.cacheTopN());
  }

  @Test
  void envValues_booleans() {
    assertTrue(EnvValues.getBoolean(Map.of("X", "TRUE"), "X", false));
    assertFalse(EnvValues.getBoolean(Map.of("X", "yes"), "X", true));
    assertTrue(EnvValues.getBoolean(Map.of(), "X", true));
  }
}
