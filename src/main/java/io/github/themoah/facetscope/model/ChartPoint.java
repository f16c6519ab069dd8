package io.github.themoah.facetscope.model;

import java.time.Instant;

/**
 * One bucket of the chart series shown to the user.
 * Only the timestamp is used here: the first and last points bound the visible window.
 */
public record ChartPoint(Instant t, long countOk, long count4xx, long count5xx) {

  public static ChartPoint at(Instant t) {
    return new ChartPoint(t, 0, 0, 0);
  }
}
