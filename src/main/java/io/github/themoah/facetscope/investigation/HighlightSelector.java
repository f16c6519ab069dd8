package io.github.themoah.facetscope.investigation;

import io.github.themoah.facetscope.model.Contributor;
import io.github.themoah.facetscope.model.HighlightKey;
import io.github.themoah.facetscope.model.SelectionContributor;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Picks which rows to highlight from a prioritized contributor list.
 */
public final class HighlightSelector {

  private HighlightSelector() {}

  /**
   * Walks contributors in order and keeps the first {@code budget} that are rendered.
   * When an anomaly is focused, contributors of other anomalies are skipped.
   *
   * @param contributors contributors in priority order
   * @param renderable rows currently rendered
   * @param focusedAnomalyId focused anomaly, or null
   * @param budget maximum highlights
   * @return highlighted rows in priority order, keyed by the rendered dimension value
   */
  public static Set<HighlightKey> select(List<Contributor> contributors, RenderableRows renderable,
                                         String focusedAnomalyId, int budget) {
    Set<HighlightKey> highlighted = new LinkedHashSet<>();
    for (Contributor c : contributors) {
      if (highlighted.size() >= budget) {
        break;
      }
      if (focusedAnomalyId != null && !focusedAnomalyId.equals(c.anomalyId())) {
        continue;
      }
      renderable.findRow(c.facetId(), c.dim())
        .ifPresent(row -> highlighted.add(new HighlightKey(c.facetId(), row)));
    }
    return highlighted;
  }

  /**
   * Same walk for selection contributors, which are never focused.
   */
  public static Set<HighlightKey> selectSelection(List<SelectionContributor> contributors, RenderableRows renderable,
                                                  int budget) {
    Set<HighlightKey> highlighted = new LinkedHashSet<>();
    for (SelectionContributor c : contributors) {
      if (highlighted.size() >= budget) {
        break;
      }
      Optional<String> row = renderable.findRow(c.facetId(), c.dim());
      row.ifPresent(r -> highlighted.add(new HighlightKey(c.facetId(), r)));
    }
    return highlighted;
  }
}
