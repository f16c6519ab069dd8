package io.github.themoah.facetscope.cache;

import io.github.themoah.facetscope.context.QueryContext;
import io.github.themoah.facetscope.model.Contributor;
import io.github.themoah.facetscope.model.InvestigationResult;
import java.util.List;

/**
 * The single in-process cache slot: the most recent investigation of this session.
 */
public record MemoryEntry(
  String key,
  List<InvestigationResult> results,
  QueryContext context,
  List<Contributor> topContributors
) {
  public MemoryEntry {
    results = results == null ? List.of() : List.copyOf(results);
    topContributors = topContributors == null ? List.of() : List.copyOf(topContributors);
  }
}
