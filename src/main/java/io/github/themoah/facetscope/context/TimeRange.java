package io.github.themoah.facetscope.context;

/**
 * Predefined relative time ranges.
 */
public enum TimeRange {
  LAST_15_MINUTES("15m", "INTERVAL 15 MINUTE"),
  LAST_HOUR("1h", "INTERVAL 1 HOUR"),
  LAST_12_HOURS("12h", "INTERVAL 12 HOUR"),
  LAST_24_HOURS("24h", "INTERVAL 24 HOUR"),
  LAST_7_DAYS("7d", "INTERVAL 7 DAY");

  private final String value;
  private final String interval;

  TimeRange(String value, String interval) {
    this.value = value;
    this.interval = interval;
  }

  public String getValue() {
    return value;
  }

  public String interval() {
    return interval;
  }

  public static TimeRange fromValue(String value) {
    for (TimeRange range : values()) {
      if (range.value.equals(value)) {
        return range;
      }
    }
    throw new IllegalArgumentException("Unknown time range: " + value);
  }
}
