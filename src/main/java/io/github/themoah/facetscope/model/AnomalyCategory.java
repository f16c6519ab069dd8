package io.github.themoah.facetscope.model;

/**
 * Status class an anomaly was detected in.
 * BLUE is the unfiltered sentinel used for ad-hoc selections.
 */
public enum AnomalyCategory {
  RED("red"),
  YELLOW("yellow"),
  GREEN("green"),
  BLUE("blue");

  private final String value;

  AnomalyCategory(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * Maps a wire value ("red", "yellow", ...) to a category.
   * Unknown or null values map to GREEN, matching the detector's default.
   */
  public static AnomalyCategory fromValue(String value) {
    if (value == null) {
      return GREEN;
    }
    for (AnomalyCategory category : values()) {
      if (category.value.equalsIgnoreCase(value)) {
        return category;
      }
    }
    return GREEN;
  }
}
