package io.github.themoah.facetscope.context;

import io.github.themoah.facetscope.model.FilterGroup;
import java.util.Map;

/**
 * Active filters rendered as a SQL fragment plus their structured per-column map.
 *
 * @param sql fragment of "AND ..." clauses, empty when there are no filters
 * @param map column to filter group, in first-seen column order
 */
public record CompiledFilters(String sql, Map<String, FilterGroup> map) {

  public static final CompiledFilters EMPTY = new CompiledFilters("", Map.of());

  public CompiledFilters {
    map = Map.copyOf(map);
  }
}
