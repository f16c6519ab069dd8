package io.github.themoah.facetscope.context;

import io.github.themoah.facetscope.model.FilterClause;
import java.util.List;

/**
 * Accessors for the query state currently shown to the user.
 */
public interface QueryContextProvider {

  /**
   * Resolved time predicate for the visible range.
   */
  String timeFilter();

  /**
   * Resolved host predicate, empty when no host filter is active.
   */
  String hostFilter();

  /**
   * Active facet filters.
   */
  List<FilterClause> filters();

  /**
   * Table queried for investigations.
   */
  String table();

  /**
   * Anomaly the user is focused on, or null.
   */
  String focusedAnomalyId();

  /**
   * Active facet filters rendered as SQL.
   */
  default String facetFilterSql() {
    return FilterCompiler.compile(filters()).sql();
  }

  /**
   * Snapshot of the current state for cache comparison.
   */
  default QueryContext snapshot() {
    return new QueryContext(timeFilter(), hostFilter(), FilterCompiler.compile(filters()).map());
  }
}
