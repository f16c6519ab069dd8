package io.github.themoah.facetscope.model;

import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.Objects;

/**
 * A time-bounded spike or dip produced by the external detector.
 *
 * @param rank detector rank (1 = most significant)
 * @param category status class the anomaly was detected in
 * @param type spike or dip
 * @param startTime window start
 * @param endTime window end
 * @param magnitude detector-specific magnitude
 */
public record Anomaly(
  int rank,
  AnomalyCategory category,
  AnomalyType type,
  Instant startTime,
  Instant endTime,
  double magnitude
) {
  public Anomaly {
    Objects.requireNonNull(category, "category cannot be null");
    Objects.requireNonNull(type, "type cannot be null");
    Objects.requireNonNull(startTime, "startTime cannot be null");
    Objects.requireNonNull(endTime, "endTime cannot be null");
  }

  public TimeWindow window() {
    return new TimeWindow(startTime, endTime);
  }

  /**
   * Short description such as "#1 red spike".
   */
  public String describe() {
    return "#" + rank + " " + category.getValue() + " " + type.getValue();
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("rank", rank)
      .put("category", category.getValue())
      .put("type", type.getValue())
      .put("startTime", startTime.toString())
      .put("endTime", endTime.toString())
      .put("magnitude", magnitude);
  }

  /**
   * Parses an anomaly; times may be ISO-8601 strings or epoch milliseconds.
   */
  public static Anomaly fromJson(JsonObject json) {
    return new Anomaly(
      json.getInteger("rank", 0),
      AnomalyCategory.fromValue(json.getString("category")),
      AnomalyType.fromValue(json.getString("type", AnomalyType.SPIKE.getValue())),
      parseInstant(json.getValue("startTime")),
      parseInstant(json.getValue("endTime")),
      json.getDouble("magnitude", 0.0)
    );
  }

  /**
   * Parses an instant from an ISO-8601 string or epoch milliseconds.
   */
  public static Instant parseInstant(Object value) {
    if (value instanceof Number number) {
      return Instant.ofEpochMilli(number.longValue());
    }
    if (value instanceof String text) {
      return Instant.parse(text);
    }
    throw new IllegalArgumentException("Expected ISO-8601 string or epoch millis, got: " + value);
  }
}
