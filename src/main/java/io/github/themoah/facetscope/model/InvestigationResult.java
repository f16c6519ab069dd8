package io.github.themoah.facetscope.model;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Investigation of a single anomaly. Facets are filled in as their analyses resolve.
 * Only mutated from the event loop that owns the investigation.
 */
public class InvestigationResult {

  private final Anomaly anomaly;
  private final String anomalyId;
  private final Map<String, List<Contributor>> facets = new LinkedHashMap<>();
  private InvestigationState state;

  public InvestigationResult(Anomaly anomaly, String anomalyId) {
    this(anomaly, anomalyId, InvestigationState.UNINVESTIGATED);
  }

  public InvestigationResult(Anomaly anomaly, String anomalyId, InvestigationState state) {
    this.anomaly = anomaly;
    this.anomalyId = anomalyId;
    this.state = state;
  }

  public Anomaly anomaly() {
    return anomaly;
  }

  public String anomalyId() {
    return anomalyId;
  }

  public InvestigationState state() {
    return state;
  }

  public void markAwaitingFacets() {
    this.state = InvestigationState.AWAITING_FACETS;
  }

  public void markComplete() {
    this.state = InvestigationState.COMPLETE;
  }

  /**
   * Records the contributors found for a facet. Empty lists are not stored.
   */
  public void putFacet(String facetId, List<Contributor> contributors) {
    if (!contributors.isEmpty()) {
      facets.put(facetId, List.copyOf(contributors));
    }
  }

  public Map<String, List<Contributor>> facets() {
    return Collections.unmodifiableMap(facets);
  }

  public List<Contributor> facet(String facetId) {
    return facets.getOrDefault(facetId, List.of());
  }

  /**
   * All contributors of all facets, in facet resolution order.
   */
  public List<Contributor> allContributors() {
    List<Contributor> all = new ArrayList<>();
    facets.values().forEach(all::addAll);
    return all;
  }

  public JsonObject toJson() {
    JsonObject facetsJson = new JsonObject();
    facets.forEach((facetId, contributors) -> {
      JsonArray array = new JsonArray();
      contributors.forEach(c -> array.add(c.toJson()));
      facetsJson.put(facetId, array);
    });
    return new JsonObject()
      .put("anomaly", anomaly.toJson())
      .put("anomalyId", anomalyId)
      .put("state", state.name())
      .put("facets", facetsJson);
  }

  public static InvestigationResult fromJson(JsonObject json) {
    String stateName = json.getString("state", InvestigationState.COMPLETE.name());
    InvestigationResult result = new InvestigationResult(
      Anomaly.fromJson(json.getJsonObject("anomaly")),
      json.getString("anomalyId"),
      InvestigationState.valueOf(stateName)
    );
    JsonObject facetsJson = json.getJsonObject("facets", new JsonObject());
    for (String facetId : facetsJson.fieldNames()) {
      List<Contributor> contributors = new ArrayList<>();
      for (Object item : facetsJson.getJsonArray(facetId)) {
        contributors.add(Contributor.fromJson((JsonObject) item));
      }
      result.putFacet(facetId, contributors);
    }
    return result;
  }
}
