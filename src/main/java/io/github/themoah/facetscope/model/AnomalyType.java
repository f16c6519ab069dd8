package io.github.themoah.facetscope.model;

/**
 * Direction of a detected anomaly.
 */
public enum AnomalyType {
  SPIKE("spike"),
  DIP("dip"),
  SELECTION("selection");

  private final String value;

  AnomalyType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  public static AnomalyType fromValue(String value) {
    for (AnomalyType type : values()) {
      if (type.value.equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown anomaly type: " + value);
  }
}
