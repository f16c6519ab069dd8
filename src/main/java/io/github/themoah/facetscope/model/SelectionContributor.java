package io.github.themoah.facetscope.model;

import io.vertx.core.json.JsonObject;
import java.util.Comparator;

/**
 * A dimension value whose behaviour changed inside a user-chosen selection.
 *
 * @param facetId facet the value belongs to
 * @param dim the dimension value
 * @param selectionRate requests per minute inside the selection
 * @param baselineRate requests per minute in the rest of the visible range
 * @param rateChange percent change baseline to selection; +Infinity when the value is new
 * @param trafficShareChange change of the value's share of all traffic, in pp
 * @param errShareChange change of the value's share of all errors, in pp
 * @param errRateChange change of the value's own error rate, in pp
 * @param maxChange ranking key: largest absolute value of the three signals
 * @param shareChange displayed value: the signed signal with the largest magnitude
 */
public record SelectionContributor(
  String facetId,
  String dim,
  double selectionRate,
  double baselineRate,
  double rateChange,
  double trafficShareChange,
  double errShareChange,
  double errRateChange,
  double maxChange,
  double shareChange
) {

  /**
   * Strongest change first, ties by facet and dimension value.
   */
  public static final Comparator<SelectionContributor> BY_MAX_CHANGE =
    Comparator.comparingDouble(SelectionContributor::maxChange).reversed()
      .thenComparing(SelectionContributor::facetId, Comparator.nullsLast(Comparator.naturalOrder()))
      .thenComparing(SelectionContributor::dim, Comparator.nullsLast(Comparator.naturalOrder()));

  public AnomalyCategory category() {
    return AnomalyCategory.BLUE;
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("facetId", facetId)
      .put("dim", dim)
      .put("category", category().getValue())
      .put("selectionRate", selectionRate)
      .put("baselineRate", baselineRate)
      .put("rateChange", Contributor.encodeDouble(rateChange))
      .put("trafficShareChange", trafficShareChange)
      .put("errShareChange", errShareChange)
      .put("errRateChange", errRateChange)
      .put("maxChange", maxChange)
      .put("shareChange", shareChange);
  }
}
