package io.github.themoah.facetscope.cache;

import io.github.themoah.facetscope.context.QueryContext;
import io.github.themoah.facetscope.model.Contributor;
import io.github.themoah.facetscope.model.InvestigationResult;
import java.util.List;

/**
 * A persisted investigation.
 *
 * @param results per-anomaly results
 * @param topContributors best contributors across all anomalies, empty for entries written before they were stored
 * @param context query context the results were computed for, null for legacy entries
 * @param version algorithm version that produced the entry
 * @param timestamp write time in epoch millis
 */
public record CacheEntry(
  List<InvestigationResult> results,
  List<Contributor> topContributors,
  QueryContext context,
  int version,
  long timestamp
) {
  public CacheEntry {
    results = results == null ? List.of() : List.copyOf(results);
    topContributors = topContributors == null ? List.of() : List.copyOf(topContributors);
  }

  public boolean hasTopContributors() {
    return !topContributors.isEmpty();
  }

  public boolean isLegacy() {
    return context == null;
  }
}
