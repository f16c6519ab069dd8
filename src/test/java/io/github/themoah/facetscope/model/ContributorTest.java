package io.github.themoah.facetscope.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the JSON forms of the model records.
 */
public class ContributorTest {

  @Test
  void infiniteRateChangeIsWrittenAsString() {
    Contributor fresh = new Contributor("breakdown-hosts", "new.com", AnomalyCategory.RED,
      4.0, 0, Double.POSITIVE_INFINITY, 28.6, 0, 28.6, 100, 1, null);

    JsonObject json = fresh.toJson();

    assertEquals("Infinity", json.getValue("rateChange"));
    assertFalse(json.containsKey("anomalyId"));
    Contributor parsed = Contributor.fromJson(new JsonObject(json.encode()));
    assertTrue(parsed.isNewDuringAnomaly());
    assertNull(parsed.anomalyId());
  }

  @Test
  void tagged_setsAnomalyAndRank() {
    Contributor c = new Contributor("breakdown-paths", "/x", AnomalyCategory.YELLOW,
      8, 0.5, 1500, 60, 10, 50, 20, 0, null);

    Contributor tagged = c.tagged("teal-pumpkin-monte", 2);

    assertEquals("teal-pumpkin-monte", tagged.anomalyId());
    assertEquals(2, tagged.rank());
    assertEquals(new HighlightKey("breakdown-paths", "/x"), tagged.highlightKey());
  }

  @Test
  void facetRow_parsesStringAndNumericCounts() {
    FacetRow row = FacetRow.fromAnomalyJson(new JsonObject()
      .put("dim", 503)
      .put("anomaly_cat_cnt", "18446744")
      .put("baseline_cat_cnt", 12)
      .put("anomaly_total_cnt", "n/a"));

    assertEquals("503", row.dim());
    assertEquals(18446744L, row.windowCategoryCount());
    assertEquals(12L, row.baselineCategoryCount());
    assertEquals(0L, row.windowTotalCount());
    assertEquals(0L, row.baselineTotalCount());
  }

  @Test
  void anomaly_acceptsIsoAndEpochTimes() {
    Anomaly anomaly = Anomaly.fromJson(new JsonObject()
      .put("rank", 3)
      .put("category", "YELLOW")
      .put("type", "dip")
      .put("startTime", "2025-01-01T10:00:00Z")
      .put("endTime", Instant.parse("2025-01-01T10:05:00Z").toEpochMilli()));

    assertEquals(AnomalyCategory.YELLOW, anomaly.category());
    assertEquals(AnomalyType.DIP, anomaly.type());
    assertEquals(5.0, anomaly.window().durationMinutes());
    assertEquals("#3 yellow dip", anomaly.describe());
    assertEquals(anomaly, Anomaly.fromJson(anomaly.toJson()));
  }

  @Test
  void anomaly_rejectsMissingTimes() {
    assertThrows(IllegalArgumentException.class,
      () -> Anomaly.fromJson(new JsonObject().put("category", "red").put("startTime", "2025-01-01T10:00:00Z")));
  }

  @Test
  void investigationResult_dropsEmptyFacets() {
    Anomaly anomaly = new Anomaly(1, AnomalyCategory.RED, AnomalyType.SPIKE,
      Instant.parse("2025-01-01T10:00:00Z"), Instant.parse("2025-01-01T10:05:00Z"), 1.0);
    InvestigationResult result = new InvestigationResult(anomaly, "teal-cerise-miata");

    result.putFacet("breakdown-hosts", List.of());

    assertTrue(result.facets().isEmpty());
    assertEquals(InvestigationState.UNINVESTIGATED, result.state());
  }

  @Test
  void byShareChange_breaksTiesByRankFacetAndDim() {
    Contributor strongest = shareChange("breakdown-paths", "/z", 60, 2);
    Contributor rankTwo = shareChange("breakdown-hosts", "a.com", 40, 2);
    Contributor paths = shareChange("breakdown-paths", "/a", 40, 1);
    Contributor hostB = shareChange("breakdown-hosts", "b.com", 40, 1);
    Contributor hostA = shareChange("breakdown-hosts", "a.com", 40, 1);
    List<Contributor> expected = List.of(strongest, hostA, hostB, paths, rankTwo);

    List<Contributor> arrived = new ArrayList<>(List.of(rankTwo, paths, hostB, strongest, hostA));
    arrived.sort(Contributor.BY_SHARE_CHANGE);
    assertEquals(expected, arrived);

    List<Contributor> reversed = new ArrayList<>(List.of(hostA, strongest, hostB, paths, rankTwo));
    reversed.sort(Contributor.BY_SHARE_CHANGE);
    assertEquals(expected, reversed);
  }

  private static Contributor shareChange(String facetId, String dim, double change, int rank) {
    return new Contributor(facetId, dim, AnomalyCategory.RED, 10, 1, 900, change + 5, 5, change, 0, rank, null);
  }
}
