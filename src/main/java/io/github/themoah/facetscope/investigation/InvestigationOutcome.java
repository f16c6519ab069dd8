package io.github.themoah.facetscope.investigation;

import io.github.themoah.facetscope.model.InvestigationResult;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;

/**
 * Results of an investigation request and the tier that served them.
 */
public record InvestigationOutcome(List<InvestigationResult> results, Source source) {

  public enum Source {
    /** In-process slot reused. */
    MEMORY,
    /** Durable entry restored. */
    DURABLE,
    /** Aggregations were run. */
    FRESH,
    /** Nothing to investigate. */
    NONE,
    /** A newer investigation started before this one finished. */
    SUPERSEDED;

    public String getValue() {
      return name().toLowerCase();
    }
  }

  public InvestigationOutcome {
    results = List.copyOf(results);
  }

  public static InvestigationOutcome none() {
    return new InvestigationOutcome(List.of(), Source.NONE);
  }

  public static InvestigationOutcome superseded() {
    return new InvestigationOutcome(List.of(), Source.SUPERSEDED);
  }

  public JsonObject toJson() {
    JsonArray array = new JsonArray();
    results.forEach(r -> array.add(r.toJson()));
    return new JsonObject()
      .put("source", source.getValue())
      .put("results", array);
  }
}
