package io.github.themoah.facetscope.model;

import java.util.Objects;

/**
 * A categorical dimension that counts are grouped by.
 *
 * @param id facet identifier, e.g. "breakdown-hosts"
 * @param column SQL column expression producing the dimension value
 * @param extraFilter optional additional predicate, starting with "AND" (empty when none)
 */
public record Breakdown(String id, String column, String extraFilter) {

  public Breakdown {
    Objects.requireNonNull(id, "id cannot be null");
    Objects.requireNonNull(column, "column cannot be null");
    extraFilter = extraFilter == null ? "" : extraFilter;
  }

  public static Breakdown of(String id, String column) {
    return new Breakdown(id, column, "");
  }

  public static Breakdown of(String id, String column, String extraFilter) {
    return new Breakdown(id, column, extraFilter);
  }
}
