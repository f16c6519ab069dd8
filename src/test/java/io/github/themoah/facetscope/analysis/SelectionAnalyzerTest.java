package io.github.themoah.facetscope.analysis;

import static io.github.themoah.facetscope.clickhouse.FakeAggregationExecutor.selectionRow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.facetscope.clickhouse.FakeAggregationExecutor;
import io.github.themoah.facetscope.config.InvestigationConfig;
import io.github.themoah.facetscope.context.QueryState;
import io.github.themoah.facetscope.metrics.InvestigationMetrics;
import io.github.themoah.facetscope.model.AnomalyCategory;
import io.github.themoah.facetscope.model.Breakdowns;
import io.github.themoah.facetscope.model.FacetRow;
import io.github.themoah.facetscope.model.SelectionContributor;
import io.github.themoah.facetscope.model.TimeWindow;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for SelectionAnalyzer.
 */
public class SelectionAnalyzerTest {

  private static final Instant T10 = Instant.parse("2025-01-01T10:00:00Z");
  private static final TimeWindow WINDOW = new TimeWindow(T10, Instant.parse("2025-01-01T11:00:00Z"));
  private static final TimeWindow SELECTION = new TimeWindow(T10, Instant.parse("2025-01-01T10:10:00Z"));

  private FakeAggregationExecutor executor;
  private SelectionAnalyzer analyzer;

  @BeforeEach
  void setUp() {
    executor = new FakeAggregationExecutor();
    analyzer = new SelectionAnalyzer(executor, new QueryState("requests"), InvestigationConfig.defaults(), "logs",
      InvestigationMetrics.noop());
  }

  private static List<FacetRow> rows(JsonObject... json) {
    List<FacetRow> rows = new ArrayList<>();
    for (JsonObject row : json) {
      rows.add(FacetRow.fromSelectionJson(row));
    }
    return rows;
  }

  @Test
  void analyze_keepsChangesInBothDirections() {
    List<SelectionContributor> result = analyzer.analyze("breakdown-hosts", rows(
      selectionRow("a.com", 100, 100, 50, 0),
      selectionRow("b.com", 100, 900, 0, 0)
    ), SELECTION, WINDOW);

    assertEquals(2, result.size());

    SelectionContributor a = result.get(0);
    assertEquals("a.com", a.dim());
    assertEquals(10.0, a.selectionRate());
    assertEquals(2.0, a.baselineRate());
    assertEquals(400.0, a.rateChange());
    assertEquals(40.0, a.trafficShareChange());
    assertEquals(100.0, a.errShareChange());
    assertEquals(50.0, a.errRateChange());
    assertEquals(100.0, a.maxChange());
    assertEquals(100.0, a.shareChange());
    assertEquals(AnomalyCategory.BLUE, a.category());

    SelectionContributor b = result.get(1);
    assertEquals("b.com", b.dim());
    assertEquals(40.0, b.maxChange());
    assertEquals(-40.0, b.shareChange());
    assertEquals(-40.0, b.trafficShareChange());
  }

  @Test
  void analyze_lowVolumeIsDropped() {
    List<SelectionContributor> result = analyzer.analyze("breakdown-hosts", rows(
      selectionRow("tiny.com", 2, 5, 2, 0)
    ), SELECTION, WINDOW);

    assertTrue(result.isEmpty());
  }

  @Test
  void analyze_stableTrafficIsDropped() {
    List<SelectionContributor> result = analyzer.analyze("breakdown-hosts", rows(
      selectionRow("a.com", 100, 500, 1, 5),
      selectionRow("b.com", 100, 500, 1, 5)
    ), SELECTION, WINDOW);

    assertTrue(result.isEmpty());
  }

  @Test
  void investigate_usesSelectionTemplate() {
    executor.respondWith(sql -> List.of(selectionRow("a.com", 100, 100, 50, 0)));

    Future<List<SelectionContributor>> future = analyzer.investigate(Breakdowns.DATACENTERS, SELECTION, WINDOW);

    assertTrue(future.succeeded());
    assertEquals(1, future.result().size());
    String sql = executor.queries().get(0);
    assertTrue(sql.contains("`cdn.datacenter` as dim"), sql);
    assertTrue(sql.contains("as selection_err_cnt"), sql);
  }

  @Test
  void investigate_failureYieldsEmptyList() {
    executor.failWith(new IllegalStateException("connection refused"));

    Future<List<SelectionContributor>> future = analyzer.investigate(Breakdowns.HOSTS, SELECTION, WINDOW);

    assertTrue(future.succeeded());
    assertTrue(future.result().isEmpty());
  }

  @Test
  void strongest() {
    assertEquals(-5.0, SelectionAnalyzer.strongest(3, -5, 4));
    assertEquals(5.0, SelectionAnalyzer.strongest(5, -5));
    assertEquals(0.0, SelectionAnalyzer.strongest(0, 0, 0));
  }
}
