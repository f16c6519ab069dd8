package io.github.themoah.facetscope.analysis;

import io.github.themoah.facetscope.clickhouse.AggregationExecutor;
import io.github.themoah.facetscope.clickhouse.SqlTemplates;
import io.github.themoah.facetscope.config.InvestigationConfig;
import io.github.themoah.facetscope.context.QueryContextProvider;
import io.github.themoah.facetscope.context.TimeFilters;
import io.github.themoah.facetscope.metrics.InvestigationMetrics;
import io.github.themoah.facetscope.model.Anomaly;
import io.github.themoah.facetscope.model.AnomalyCategory;
import io.github.themoah.facetscope.model.Breakdown;
import io.github.themoah.facetscope.model.Contributor;
import io.github.themoah.facetscope.model.FacetRow;
import io.github.themoah.facetscope.model.TimeWindow;
import io.vertx.core.Future;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares one facet's category volume inside an anomaly window against the rest of the
 * visible range and keeps the dimension values that gained share or error rate.
 */
public class FacetAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(FacetAnalyzer.class);

  static final String TEMPLATE = "investigate-facet";

  private final AggregationExecutor executor;
  private final QueryContextProvider context;
  private final InvestigationConfig config;
  private final String database;
  private final InvestigationMetrics metrics;

  public FacetAnalyzer(AggregationExecutor executor, QueryContextProvider context, InvestigationConfig config,
                       String database, InvestigationMetrics metrics) {
    this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    this.context = Objects.requireNonNull(context, "context cannot be null");
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.database = Objects.requireNonNull(database, "database cannot be null");
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
  }

  /**
   * Runs the facet aggregation and analyzes the rows.
   * Never fails: an aggregation failure is logged and yields an empty list.
   *
   * @param breakdown facet to investigate
   * @param anomaly the anomaly, its window must lie inside {@code window}
   * @param window the full visible range
   * @return at most the configured number of contributors, ordered by share change
   */
  public Future<List<Contributor>> investigate(Breakdown breakdown, Anomaly anomaly, TimeWindow window) {
    return investigate(breakdown, anomaly, window, context);
  }

  /**
   * Same as {@link #investigate(Breakdown, Anomaly, TimeWindow)}, against the given query
   * state instead of the live one.
   */
  public Future<List<Contributor>> investigate(Breakdown breakdown, Anomaly anomaly, TimeWindow window,
                                               QueryContextProvider query) {
    String sql;
    try {
      sql = buildSql(breakdown, anomaly, window, query);
    } catch (RuntimeException e) {
      log.warn("Investigation error for {}: {}", breakdown.id(), e.getMessage());
      metrics.recordFacetFailure(breakdown.id());
      return Future.succeededFuture(List.of());
    }

    return executor.runAggregation(sql)
      .map(rows -> analyze(
        breakdown.id(),
        rows.stream().map(FacetRow::fromAnomalyJson).collect(Collectors.toList()),
        anomaly,
        window))
      .recover(err -> {
        log.warn("Investigation error for {}: {}", breakdown.id(), err.getMessage());
        metrics.recordFacetFailure(breakdown.id());
        return Future.succeededFuture(List.of());
      });
  }

  /**
   * Derives rates, shares and their changes per row and keeps the significant ones.
   * All values are rounded to one decimal before filtering.
   */
  public List<Contributor> analyze(String facetId, List<FacetRow> rows, Anomaly anomaly, TimeWindow window) {
    TimeWindow anomalyWindow = anomaly.window();
    double anomalyMinutes = anomalyWindow.durationMinutes();
    double baselineMinutes = window.remainderMinutes(anomalyWindow);

    long totalAnomalyCat = 0;
    long totalBaselineCat = 0;
    for (FacetRow row : rows) {
      totalAnomalyCat += row.windowCategoryCount();
      totalBaselineCat += row.baselineCategoryCount();
    }

    List<Contributor> analyzed = new ArrayList<>(rows.size());
    for (FacetRow row : rows) {
      double anomalyRate = ChangeMath.perMinute(row.windowCategoryCount(), anomalyMinutes);
      double baselineRate = ChangeMath.perMinute(row.baselineCategoryCount(), baselineMinutes);
      double rateChange = ChangeMath.percentChange(anomalyRate, baselineRate);

      double anomalyShare = ChangeMath.percentOf(row.windowCategoryCount(), totalAnomalyCat);
      double baselineShare = ChangeMath.percentOf(row.baselineCategoryCount(), totalBaselineCat);

      double anomalyErrorRate = ChangeMath.percentOf(row.windowCategoryCount(), row.windowTotalCount());
      double baselineErrorRate = ChangeMath.percentOf(row.baselineCategoryCount(), row.baselineTotalCount());

      analyzed.add(new Contributor(
        facetId,
        row.dim(),
        anomaly.category(),
        ChangeMath.round1(anomalyRate),
        ChangeMath.round1(baselineRate),
        ChangeMath.round1(rateChange),
        ChangeMath.round1(anomalyShare),
        ChangeMath.round1(baselineShare),
        ChangeMath.round1(anomalyShare - baselineShare),
        ChangeMath.round1(anomalyErrorRate - baselineErrorRate),
        anomaly.rank(),
        null
      ));
    }

    double threshold = config.significanceThreshold();
    List<Contributor> significant = analyzed.stream()
      .filter(c -> c.anomalyRate() > config.minAnomalyRate())
      .filter(c -> c.shareChange() > threshold || c.errorRateChange() > threshold)
      .sorted(Contributor.BY_SHARE_CHANGE)
      .limit(config.facetResultLimit())
      .collect(Collectors.toList());

    log.debug("{}: {} rows, {} significant for {}", facetId, rows.size(), significant.size(), anomaly.describe());
    return significant;
  }

  String buildSql(Breakdown breakdown, Anomaly anomaly, TimeWindow window) {
    return buildSql(breakdown, anomaly, window, context);
  }

  String buildSql(Breakdown breakdown, Anomaly anomaly, TimeWindow window, QueryContextProvider query) {
    return SqlTemplates.render(TEMPLATE, Map.of(
      "anomalyMinuteFilter", TimeFilters.minuteBetween(anomaly.startTime(), anomaly.endTime()),
      "col", breakdown.column(),
      "catCountExpr", categoryCountColumn(anomaly.category()),
      "database", database,
      "table", query.table(),
      "timeFilter", TimeFilters.between(window.start(), window.end()),
      "hostFilter", query.hostFilter(),
      "facetFilters", query.facetFilterSql(),
      "extra", breakdown.extraFilter()
    ));
  }

  /**
   * Per-minute count column matching the anomaly's status class.
   */
  static String categoryCountColumn(AnomalyCategory category) {
    return switch (category) {
      case RED -> "cnt_5xx";
      case YELLOW -> "cnt_4xx";
      case GREEN -> "cnt_ok";
      case BLUE -> "cnt";
    };
  }
}
