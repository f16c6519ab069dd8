package io.github.themoah.facetscope.model;

/**
 * Identifies a rendered breakdown row: a facet and one of its dimension values.
 */
public record HighlightKey(String facetId, String dim) {}
