package io.github.themoah.facetscope.investigation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.facetscope.model.AnomalyCategory;
import io.github.themoah.facetscope.model.Contributor;
import io.github.themoah.facetscope.model.HighlightKey;
import io.github.themoah.facetscope.model.SelectionContributor;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for HighlightSelector.
 */
public class HighlightSelectorTest {

  private static Contributor contributor(String facetId, String dim, String anomalyId) {
    return new Contributor(facetId, dim, AnomalyCategory.RED, 10, 1, 900, 60, 10, 50, 20, 1, anomalyId);
  }

  private static final List<Contributor> CONTRIBUTORS = List.of(
    contributor("breakdown-hosts", "a.com", "id-1"),
    contributor("breakdown-paths", "/x", "id-2"),
    contributor("breakdown-hosts", "a.com", "id-2"),
    contributor("breakdown-hosts", "b.com", "id-1"),
    contributor("breakdown-paths", "/y", "id-1")
  );

  @Test
  void select_keepsPriorityOrderWithinBudget() {
    Set<HighlightKey> keys = HighlightSelector.select(CONTRIBUTORS, RenderableRows.ALL, null, 3);

    assertEquals(List.of(
      new HighlightKey("breakdown-hosts", "a.com"),
      new HighlightKey("breakdown-paths", "/x"),
      new HighlightKey("breakdown-hosts", "b.com")), List.copyOf(keys));
  }

  @Test
  void select_skipsUnrenderedRows() {
    RenderedRows rendered = new RenderedRows();
    rendered.update("breakdown-paths", List.of("/x", "/y"));

    Set<HighlightKey> keys = HighlightSelector.select(CONTRIBUTORS, rendered, null, 3);

    assertEquals(List.of(new HighlightKey("breakdown-paths", "/x"), new HighlightKey("breakdown-paths", "/y")),
      List.copyOf(keys));
  }

  @Test
  void select_honorsFocus() {
    Set<HighlightKey> keys = HighlightSelector.select(CONTRIBUTORS, RenderableRows.ALL, "id-2", 3);

    assertEquals(List.of(new HighlightKey("breakdown-paths", "/x"), new HighlightKey("breakdown-hosts", "a.com")),
      List.copyOf(keys));
  }

  @Test
  void select_emptyInput() {
    assertTrue(HighlightSelector.select(List.of(), RenderableRows.ALL, null, 3).isEmpty());
  }

  @Test
  void selectSelection_usesRenderedDimension() {
    RenderedRows rendered = new RenderedRows();
    rendered.update("breakdown-hosts", List.of("Example.COM"));
    List<SelectionContributor> contributors = List.of(
      new SelectionContributor("breakdown-hosts", "example.com", 10, 2, 400, 40, 100, 50, 100, 100),
      new SelectionContributor("breakdown-hosts", "other.com", 10, 2, 400, 40, 10, 5, 40, 40));

    Set<HighlightKey> keys = HighlightSelector.selectSelection(contributors, rendered, 3);

    assertEquals(Set.of(new HighlightKey("breakdown-hosts", "Example.COM")), keys);
  }
}
