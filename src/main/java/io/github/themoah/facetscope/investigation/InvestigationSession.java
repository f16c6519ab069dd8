package io.github.themoah.facetscope.investigation;

import io.github.themoah.facetscope.model.Contributor;
import io.github.themoah.facetscope.model.HighlightKey;
import io.github.themoah.facetscope.model.InvestigationResult;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Investigation state of the single user session. Confined to the owning event loop.
 *
 * <p>The epoch identifies the current fresh investigation. Work started under an older
 * epoch must check {@link #isCurrent(long)} before touching this state.
 */
public class InvestigationSession {

  private long epoch;

  private List<InvestigationResult> results = new ArrayList<>();
  private List<Contributor> contributors = new ArrayList<>();
  private List<Contributor> cachedTopContributors = List.of();

  private final Map<String, InvestigationResult> resultsByAnomalyId = new HashMap<>();
  private final Map<Integer, String> anomalyIdsByRank = new HashMap<>();

  private Set<HighlightKey> highlights = new LinkedHashSet<>();
  private Set<HighlightKey> selectionHighlights = new LinkedHashSet<>();

  /**
   * Starts a new epoch; work of earlier epochs becomes stale.
   */
  public long nextEpoch() {
    return ++epoch;
  }

  public boolean isCurrent(long candidate) {
    return candidate == epoch;
  }

  /**
   * Clears results and running contributors before a fresh investigation.
   * The anomaly id lookup survives so earlier ids stay addressable.
   */
  public void resetForFresh() {
    results = new ArrayList<>();
    contributors = new ArrayList<>();
  }

  public void clearResults() {
    results = new ArrayList<>();
    contributors = new ArrayList<>();
    cachedTopContributors = List.of();
  }

  public void register(InvestigationResult result) {
    results.add(result);
    index(result);
  }

  /**
   * Replaces the results with restored ones and indexes them.
   */
  public void restore(List<InvestigationResult> restored) {
    results = new ArrayList<>(restored);
    contributors = new ArrayList<>();
    restored.forEach(this::index);
  }

  private void index(InvestigationResult result) {
    if (result.anomalyId() != null) {
      resultsByAnomalyId.put(result.anomalyId(), result);
      if (result.anomaly() != null && result.anomaly().rank() > 0) {
        anomalyIdsByRank.put(result.anomaly().rank(), result.anomalyId());
      }
    }
  }

  public List<InvestigationResult> results() {
    return List.copyOf(results);
  }

  public void addContributors(List<Contributor> found) {
    contributors.addAll(found);
  }

  /**
   * Running contributors in {@link Contributor#BY_SHARE_CHANGE} order, independent of the
   * order in which facets resolved.
   */
  public List<Contributor> sortedContributors() {
    List<Contributor> sorted = new ArrayList<>(contributors);
    sorted.sort(Contributor.BY_SHARE_CHANGE);
    return sorted;
  }

  public List<Contributor> cachedTopContributors() {
    return cachedTopContributors;
  }

  public void cachedTopContributors(List<Contributor> top) {
    this.cachedTopContributors = top == null ? List.of() : List.copyOf(top);
  }

  public Optional<InvestigationResult> resultByAnomalyId(String anomalyId) {
    return Optional.ofNullable(resultsByAnomalyId.get(anomalyId));
  }

  /**
   * Anomaly id for a rank, looked up in the current results first and then in the
   * assignments recorded by earlier investigations of this session.
   */
  public Optional<String> anomalyIdByRank(int rank) {
    for (InvestigationResult result : results) {
      if (result.anomaly() != null && result.anomaly().rank() == rank) {
        return Optional.ofNullable(result.anomalyId());
      }
    }
    return Optional.ofNullable(anomalyIdsByRank.get(rank));
  }

  public Set<HighlightKey> highlights() {
    return highlights;
  }

  public void highlights(Set<HighlightKey> updated) {
    this.highlights = new LinkedHashSet<>(updated);
  }

  public void clearHighlights() {
    highlights = new LinkedHashSet<>();
  }

  public Set<HighlightKey> selectionHighlights() {
    return selectionHighlights;
  }

  public void selectionHighlights(Set<HighlightKey> updated) {
    this.selectionHighlights = new LinkedHashSet<>(updated);
  }

  public void clearSelection() {
    selectionHighlights = new LinkedHashSet<>();
  }
}
