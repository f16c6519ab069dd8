package io.github.themoah.facetscope.investigation;

import java.util.Optional;

/**
 * Tells which breakdown rows the client currently renders, so highlights only go to visible rows.
 */
public interface RenderableRows {

  /**
   * Treats every dimension value as rendered.
   */
  RenderableRows ALL = (facetId, dim) -> Optional.ofNullable(dim);

  /**
   * Finds the rendered row for a dimension value.
   *
   * @param facetId the facet
   * @param dim the dimension value to look for
   * @return the rendered row's dimension value, or empty if no row matches
   */
  Optional<String> findRow(String facetId, String dim);

  default boolean isRenderable(String facetId, String dim) {
    return findRow(facetId, dim).isPresent();
  }
}
