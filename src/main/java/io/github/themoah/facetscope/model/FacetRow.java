package io.github.themoah.facetscope.model;

import io.vertx.core.json.JsonObject;

/**
 * One aggregated row of a facet investigation query.
 * Counts split per window: the anomaly (or selection) window versus the rest of the visible range.
 *
 * @param dim dimension value
 * @param windowCategoryCount category-matching requests inside the window
 * @param baselineCategoryCount category-matching requests outside the window
 * @param windowTotalCount all requests inside the window
 * @param baselineTotalCount all requests outside the window
 */
public record FacetRow(
  String dim,
  long windowCategoryCount,
  long baselineCategoryCount,
  long windowTotalCount,
  long baselineTotalCount
) {

  /**
   * Parses an anomaly investigation row.
   * ClickHouse renders UInt64 as strings in JSON output; unparsable counts are treated as 0.
   */
  public static FacetRow fromAnomalyJson(JsonObject row) {
    return new FacetRow(
      dimOf(row),
      count(row, "anomaly_cat_cnt"),
      count(row, "baseline_cat_cnt"),
      count(row, "anomaly_total_cnt"),
      count(row, "baseline_total_cnt")
    );
  }

  /**
   * Parses a selection investigation row. Category counts hold the error (status >= 400) counts.
   */
  public static FacetRow fromSelectionJson(JsonObject row) {
    return new FacetRow(
      dimOf(row),
      count(row, "selection_err_cnt"),
      count(row, "baseline_err_cnt"),
      count(row, "selection_cnt"),
      count(row, "baseline_cnt")
    );
  }

  private static String dimOf(JsonObject row) {
    Object dim = row.getValue("dim");
    return dim == null ? "" : String.valueOf(dim);
  }

  static long count(JsonObject row, String field) {
    Object value = row.getValue(field);
    if (value instanceof Number number) {
      return number.longValue();
    }
    if (value instanceof String text && !text.isBlank()) {
      try {
        return Long.parseLong(text.trim());
      } catch (NumberFormatException e) {
        return 0;
      }
    }
    return 0;
  }
}
