package io.github.themoah.facetscope.model;

import io.vertx.core.json.JsonObject;
import java.util.Comparator;

/**
 * A dimension value that contributed to an anomaly, with its change statistics.
 * All percentages are rounded to one decimal.
 *
 * @param facetId facet the value belongs to
 * @param dim the dimension value
 * @param category category of the anomaly the value was found for
 * @param anomalyRate category requests per minute inside the anomaly window
 * @param baselineRate category requests per minute outside the anomaly window
 * @param rateChange percent change baseline to anomaly; +Infinity when the value is new
 * @param anomalyShare percent share of the category volume inside the window
 * @param baselineShare percent share of the category volume outside the window
 * @param shareChange anomalyShare - baselineShare, in percentage points
 * @param errorRateChange change of the value's category/total ratio, in percentage points
 * @param rank rank of the anomaly the value was found for
 * @param anomalyId id of the anomaly the value was found for (null until tagged)
 */
public record Contributor(
  String facetId,
  String dim,
  AnomalyCategory category,
  double anomalyRate,
  double baselineRate,
  double rateChange,
  double anomalyShare,
  double baselineShare,
  double shareChange,
  double errorRateChange,
  int rank,
  String anomalyId
) {

  private static final String INFINITY = "Infinity";

  /**
   * Largest share change first. Equal changes fall back to anomaly rank, then facet and
   * dimension value, so the order does not depend on when each facet resolved.
   */
  public static final Comparator<Contributor> BY_SHARE_CHANGE =
    Comparator.comparingDouble(Contributor::shareChange).reversed()
      .thenComparingInt(Contributor::rank)
      .thenComparing(Contributor::facetId, Comparator.nullsLast(Comparator.naturalOrder()))
      .thenComparing(Contributor::dim, Comparator.nullsLast(Comparator.naturalOrder()));

  /**
   * Returns a copy attributed to the given anomaly.
   */
  public Contributor tagged(String anomalyId, int rank) {
    return new Contributor(facetId, dim, category, anomalyRate, baselineRate, rateChange,
      anomalyShare, baselineShare, shareChange, errorRateChange, rank, anomalyId);
  }

  public boolean isNewDuringAnomaly() {
    return Double.isInfinite(rateChange);
  }

  public HighlightKey highlightKey() {
    return new HighlightKey(facetId, dim);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("facetId", facetId)
      .put("dim", dim)
      .put("category", category.getValue())
      .put("anomalyRate", anomalyRate)
      .put("baselineRate", baselineRate)
      .put("rateChange", encodeDouble(rateChange))
      .put("anomalyShare", anomalyShare)
      .put("baselineShare", baselineShare)
      .put("shareChange", shareChange)
      .put("errorRateChange", errorRateChange)
      .put("rank", rank);
    if (anomalyId != null) {
      json.put("anomalyId", anomalyId);
    }
    return json;
  }

  public static Contributor fromJson(JsonObject json) {
    return new Contributor(
      json.getString("facetId"),
      json.getString("dim"),
      AnomalyCategory.fromValue(json.getString("category")),
      decodeDouble(json.getValue("anomalyRate")),
      decodeDouble(json.getValue("baselineRate")),
      decodeDouble(json.getValue("rateChange")),
      decodeDouble(json.getValue("anomalyShare")),
      decodeDouble(json.getValue("baselineShare")),
      decodeDouble(json.getValue("shareChange")),
      decodeDouble(json.getValue("errorRateChange")),
      json.getInteger("rank", 0),
      json.getString("anomalyId")
    );
  }

  static Object encodeDouble(double value) {
    if (Double.isInfinite(value) && value > 0) {
      return INFINITY;
    }
    return value;
  }

  static double decodeDouble(Object value) {
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (INFINITY.equals(value)) {
      return Double.POSITIVE_INFINITY;
    }
    if (value instanceof String text) {
      try {
        return Double.parseDouble(text);
      } catch (NumberFormatException e) {
        return 0.0;
      }
    }
    return 0.0;
  }
}
