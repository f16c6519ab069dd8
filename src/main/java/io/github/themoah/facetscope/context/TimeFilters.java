package io.github.themoah.facetscope.context;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Renders minute-aligned ClickHouse time and host predicates.
 * Minute alignment lets queries use the per-minute projections at the cost of up to a minute of imprecision.
 */
public final class TimeFilters {

  private static final DateTimeFormatter SQL_DATE_TIME =
    DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

  private TimeFilters() {}

  public static String sqlDateTime(Instant instant) {
    return SQL_DATE_TIME.format(instant);
  }

  /**
   * Predicate on the raw timestamp column.
   */
  public static String between(Instant start, Instant end) {
    return "toStartOfMinute(timestamp) BETWEEN toStartOfMinute(toDateTime('" + sqlDateTime(start)
      + "')) AND toStartOfMinute(toDateTime('" + sqlDateTime(end) + "'))";
  }

  /**
   * Predicate on the pre-aggregated {@code minute} column of the inner investigation query.
   */
  public static String minuteBetween(Instant start, Instant end) {
    return "minute BETWEEN toStartOfMinute(toDateTime('" + sqlDateTime(start)
      + "')) AND toStartOfMinute(toDateTime('" + sqlDateTime(end) + "'))";
  }

  /**
   * Relative predicate ending at a fixed query timestamp, e.g. the last hour.
   * The fixed timestamp keeps repeated queries identical and therefore cacheable.
   */
  public static String relative(Instant queryTimestamp, String interval) {
    String ts = sqlDateTime(queryTimestamp);
    return "toStartOfMinute(timestamp) BETWEEN toStartOfMinute(toDateTime('" + ts + "') - "
      + interval + ") AND toStartOfMinute(toDateTime('" + ts + "'))";
  }

  /**
   * Host substring predicate on the request host or forwarded host, empty when no host is set.
   */
  public static String host(String hostFilter) {
    if (hostFilter == null || hostFilter.isBlank()) {
      return "";
    }
    String escaped = FilterCompiler.escape(hostFilter);
    return "AND (`request.host` LIKE '%" + escaped + "%' OR `request.headers.x_forwarded_host` LIKE '%"
      + escaped + "%')";
  }
}
