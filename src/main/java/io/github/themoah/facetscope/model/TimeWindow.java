package io.github.themoah.facetscope.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Closed time interval.
 */
public record TimeWindow(Instant start, Instant end) {

  private static final double MILLIS_PER_MINUTE = 60_000.0;

  public TimeWindow {
    Objects.requireNonNull(start, "start cannot be null");
    Objects.requireNonNull(end, "end cannot be null");
  }

  public long durationMs() {
    return Duration.between(start, end).toMillis();
  }

  public double durationMinutes() {
    return durationMs() / MILLIS_PER_MINUTE;
  }

  public boolean contains(Instant instant) {
    return !instant.isBefore(start) && !instant.isAfter(end);
  }

  /**
   * Minutes of this window not covered by the given sub-window.
   */
  public double remainderMinutes(TimeWindow inner) {
    return (durationMs() - inner.durationMs()) / MILLIS_PER_MINUTE;
  }
}
