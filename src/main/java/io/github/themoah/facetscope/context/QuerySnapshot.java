package io.github.themoah.facetscope.context;

import io.github.themoah.facetscope.model.FilterClause;
import java.util.List;

/**
 * Immutable copy of a query state, taken when an investigation starts.
 * Later edits of the live state do not reach work already running against it.
 */
public record QuerySnapshot(
  String timeFilter,
  String hostFilter,
  List<FilterClause> filters,
  String table,
  String focusedAnomalyId
) implements QueryContextProvider {

  public QuerySnapshot {
    filters = List.copyOf(filters);
  }

  public static QuerySnapshot of(QueryContextProvider provider) {
    if (provider instanceof QuerySnapshot snapshot) {
      return snapshot;
    }
    return new QuerySnapshot(
      provider.timeFilter(),
      provider.hostFilter(),
      provider.filters(),
      provider.table(),
      provider.focusedAnomalyId());
  }
}
