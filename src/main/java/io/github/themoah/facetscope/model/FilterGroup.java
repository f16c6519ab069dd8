package io.github.themoah.facetscope.model;

import java.util.List;

/**
 * All filter values active on a single column, split into includes and excludes.
 * Values are kept in their string form so numeric and textual filters compare alike.
 */
public record FilterGroup(String column, List<String> includes, List<String> excludes) {

  public FilterGroup {
    includes = List.copyOf(includes);
    excludes = List.copyOf(excludes);
  }

  /**
   * True if this group carries every include and exclude value of {@code other}.
   */
  public boolean covers(FilterGroup other) {
    return includes.containsAll(other.includes()) && excludes.containsAll(other.excludes());
  }
}
