package io.github.themoah.facetscope.context;

import io.github.themoah.facetscope.model.FilterClause;
import io.github.themoah.facetscope.model.TimeWindow;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Mutable query state updated by the HTTP layer before each investigation.
 * Either a relative range ending at a fixed query timestamp or a custom window is active.
 */
public class QueryState implements QueryContextProvider {

  private final String table;

  private TimeRange timeRange = TimeRange.LAST_HOUR;
  private Instant queryTimestamp = Instant.now();
  private TimeWindow customWindow;
  private String host = "";
  private List<FilterClause> filters = List.of();
  private String focusedAnomalyId;

  public QueryState(String table) {
    this.table = Objects.requireNonNull(table, "table cannot be null");
  }

  public QueryState relativeRange(TimeRange range, Instant queryTimestamp) {
    this.timeRange = Objects.requireNonNull(range, "range cannot be null");
    this.queryTimestamp = Objects.requireNonNull(queryTimestamp, "queryTimestamp cannot be null");
    this.customWindow = null;
    return this;
  }

  public QueryState customRange(TimeWindow window) {
    this.customWindow = Objects.requireNonNull(window, "window cannot be null");
    return this;
  }

  public QueryState host(String host) {
    this.host = host == null ? "" : host.trim();
    return this;
  }

  public QueryState filters(List<FilterClause> filters) {
    this.filters = filters == null ? List.of() : List.copyOf(filters);
    return this;
  }

  public QueryState addFilter(FilterClause filter) {
    List<FilterClause> updated = new ArrayList<>(filters);
    updated.add(filter);
    this.filters = List.copyOf(updated);
    return this;
  }

  public QueryState removeFilter(FilterClause filter) {
    List<FilterClause> updated = new ArrayList<>(filters);
    updated.remove(filter);
    this.filters = List.copyOf(updated);
    return this;
  }

  public QueryState focus(String anomalyId) {
    this.focusedAnomalyId = anomalyId == null || anomalyId.isBlank() ? null : anomalyId;
    return this;
  }

  @Override
  public String timeFilter() {
    if (customWindow != null) {
      return TimeFilters.between(customWindow.start(), customWindow.end());
    }
    return TimeFilters.relative(queryTimestamp, timeRange.interval());
  }

  @Override
  public String hostFilter() {
    return TimeFilters.host(host);
  }

  @Override
  public List<FilterClause> filters() {
    return filters;
  }

  @Override
  public String table() {
    return table;
  }

  @Override
  public String focusedAnomalyId() {
    return focusedAnomalyId;
  }
}
