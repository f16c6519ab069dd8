package io.github.themoah.facetscope.model;

/**
 * Lifecycle of a single anomaly's investigation.
 */
public enum InvestigationState {
  UNINVESTIGATED,
  AWAITING_FACETS,
  COMPLETE
}
