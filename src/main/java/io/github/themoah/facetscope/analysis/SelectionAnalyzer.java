package io.github.themoah.facetscope.analysis;

import io.github.themoah.facetscope.clickhouse.AggregationExecutor;
import io.github.themoah.facetscope.clickhouse.SqlTemplates;
import io.github.themoah.facetscope.config.InvestigationConfig;
import io.github.themoah.facetscope.context.QueryContextProvider;
import io.github.themoah.facetscope.context.TimeFilters;
import io.github.themoah.facetscope.metrics.InvestigationMetrics;
import io.github.themoah.facetscope.model.Breakdown;
import io.github.themoah.facetscope.model.FacetRow;
import io.github.themoah.facetscope.model.SelectionContributor;
import io.github.themoah.facetscope.model.TimeWindow;
import io.vertx.core.Future;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Analyzes a user-chosen time range against the rest of the visible range without
 * assuming a category. A value qualifies when its share of traffic, its share of errors
 * or its own error rate moved in either direction.
 */
public class SelectionAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(SelectionAnalyzer.class);

  static final String TEMPLATE = "investigate-selection";

  private final AggregationExecutor executor;
  private final QueryContextProvider context;
  private final InvestigationConfig config;
  private final String database;
  private final InvestigationMetrics metrics;

  public SelectionAnalyzer(AggregationExecutor executor, QueryContextProvider context, InvestigationConfig config,
                           String database, InvestigationMetrics metrics) {
    this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    this.context = Objects.requireNonNull(context, "context cannot be null");
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.database = Objects.requireNonNull(database, "database cannot be null");
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
  }

  /**
   * Runs the selection aggregation for one facet. Never fails: errors yield an empty list.
   */
  public Future<List<SelectionContributor>> investigate(Breakdown breakdown, TimeWindow selection, TimeWindow window) {
    String sql;
    try {
      sql = buildSql(breakdown, selection, window);
    } catch (RuntimeException e) {
      log.warn("Selection investigation error for {}: {}", breakdown.id(), e.getMessage());
      metrics.recordFacetFailure(breakdown.id());
      return Future.succeededFuture(List.of());
    }

    return executor.runAggregation(sql)
      .map(rows -> analyze(
        breakdown.id(),
        rows.stream().map(FacetRow::fromSelectionJson).collect(Collectors.toList()),
        selection,
        window))
      .recover(err -> {
        log.warn("Selection investigation error for {}: {}", breakdown.id(), err.getMessage());
        metrics.recordFacetFailure(breakdown.id());
        return Future.succeededFuture(List.of());
      });
  }

  public List<SelectionContributor> analyze(String facetId, List<FacetRow> rows, TimeWindow selection,
                                            TimeWindow window) {
    double selectionMinutes = selection.durationMinutes();
    double baselineMinutes = window.remainderMinutes(selection);

    long totalSelection = 0;
    long totalBaseline = 0;
    long totalSelectionErr = 0;
    long totalBaselineErr = 0;
    for (FacetRow row : rows) {
      totalSelection += row.windowTotalCount();
      totalBaseline += row.baselineTotalCount();
      totalSelectionErr += row.windowCategoryCount();
      totalBaselineErr += row.baselineCategoryCount();
    }

    List<Candidate> analyzed = new ArrayList<>(rows.size());
    for (FacetRow row : rows) {
      double selectionRate = ChangeMath.perMinute(row.windowTotalCount(), selectionMinutes);
      double baselineRate = ChangeMath.perMinute(row.baselineTotalCount(), baselineMinutes);

      double shareChange = ChangeMath.percentOf(row.windowTotalCount(), totalSelection)
        - ChangeMath.percentOf(row.baselineTotalCount(), totalBaseline);
      double errShareChange = ChangeMath.percentOf(row.windowCategoryCount(), totalSelectionErr)
        - ChangeMath.percentOf(row.baselineCategoryCount(), totalBaselineErr);
      double errRateChange = ChangeMath.percentOf(row.windowCategoryCount(), row.windowTotalCount())
        - ChangeMath.percentOf(row.baselineCategoryCount(), row.baselineTotalCount());

      analyzed.add(new Candidate(
        row.dim(),
        ChangeMath.round1(selectionRate),
        ChangeMath.round1(baselineRate),
        ChangeMath.round1(ChangeMath.percentChange(selectionRate, baselineRate)),
        ChangeMath.round1(shareChange),
        ChangeMath.round1(errShareChange),
        ChangeMath.round1(errRateChange)
      ));
    }

    double minRate = config.minAnomalyRate();
    double threshold = config.significanceThreshold();
    List<SelectionContributor> significant = analyzed.stream()
      .filter(c -> c.selectionRate > minRate || c.baselineRate > minRate)
      .filter(c -> c.maxChange() > threshold)
      .map(c -> c.toContributor(facetId))
      .sorted(SelectionContributor.BY_MAX_CHANGE)
      .limit(config.facetResultLimit())
      .collect(Collectors.toList());

    if (significant.isEmpty() && !analyzed.isEmpty()) {
      Candidate top = analyzed.stream().max(Comparator.comparingDouble(Candidate::maxChange)).get();
      log.debug("{}: {} dims analyzed, top shareChange={}pp, errShareChange={}pp, errRateChange={}pp",
        facetId, analyzed.size(), top.shareChange, top.errShareChange, top.errRateChange);
    }
    return significant;
  }

  String buildSql(Breakdown breakdown, TimeWindow selection, TimeWindow window) {
    return SqlTemplates.render(TEMPLATE, Map.of(
      "selectionMinuteFilter", TimeFilters.minuteBetween(selection.start(), selection.end()),
      "col", breakdown.column(),
      "database", database,
      "table", context.table(),
      "timeFilter", TimeFilters.between(window.start(), window.end()),
      "hostFilter", context.hostFilter(),
      "facetFilters", context.facetFilterSql(),
      "extra", breakdown.extraFilter()
    ));
  }

  /**
   * The signed value with the largest magnitude; ties keep the earlier one, all zeros give 0.
   */
  static double strongest(double... values) {
    double strongest = 0;
    for (double v : values) {
      if (Math.abs(v) > Math.abs(strongest)) {
        strongest = v;
      }
    }
    return strongest;
  }

  private static final class Candidate {
    final String dim;
    final double selectionRate;
    final double baselineRate;
    final double rateChange;
    final double shareChange;
    final double errShareChange;
    final double errRateChange;

    Candidate(String dim, double selectionRate, double baselineRate, double rateChange,
              double shareChange, double errShareChange, double errRateChange) {
      this.dim = dim;
      this.selectionRate = selectionRate;
      this.baselineRate = baselineRate;
      this.rateChange = rateChange;
      this.shareChange = shareChange;
      this.errShareChange = errShareChange;
      this.errRateChange = errRateChange;
    }

    double maxChange() {
      return Math.max(Math.abs(shareChange), Math.max(Math.abs(errShareChange), Math.abs(errRateChange)));
    }

    SelectionContributor toContributor(String facetId) {
      return new SelectionContributor(
        facetId,
        dim,
        selectionRate,
        baselineRate,
        rateChange,
        shareChange,
        errShareChange,
        errRateChange,
        maxChange(),
        strongest(shareChange, errShareChange, errRateChange)
      );
    }
  }
}
