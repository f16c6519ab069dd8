package io.github.themoah.facetscope.investigation;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rows reported by the client per facet. Lookups try an exact match first, then a
 * case-insensitive one. Until the client reports any rows, every value counts as rendered.
 */
public class RenderedRows implements RenderableRows {

  private final Map<String, List<String>> rows = new ConcurrentHashMap<>();

  public void update(String facetId, List<String> dims) {
    if (dims == null || dims.isEmpty()) {
      rows.remove(facetId);
    } else {
      rows.put(facetId, List.copyOf(dims));
    }
  }

  public void replaceAll(Map<String, List<String>> rendered) {
    rows.clear();
    rendered.forEach(this::update);
  }

  public Map<String, List<String>> snapshot() {
    return Map.copyOf(rows);
  }

  @Override
  public Optional<String> findRow(String facetId, String dim) {
    if (rows.isEmpty()) {
      return Optional.ofNullable(dim);
    }
    List<String> facetRows = rows.get(facetId);
    if (facetRows == null || facetRows.isEmpty() || dim == null) {
      return Optional.empty();
    }
    if (facetRows.contains(dim)) {
      return Optional.of(dim);
    }
    if (dim.isEmpty()) {
      return Optional.empty();
    }
    String lower = dim.toLowerCase(Locale.ROOT);
    return facetRows.stream()
      .filter(row -> row.toLowerCase(Locale.ROOT).equals(lower))
      .findFirst();
  }
}
