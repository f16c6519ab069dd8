package io.github.themoah.facetscope.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Meters recorded by investigations and the investigation cache.
 */
public class InvestigationMetrics {

  static final String INVESTIGATIONS = "facetscope.investigations";
  static final String FACET_FAILURES = "facetscope.facet.failures";
  static final String CACHE_EVICTIONS = "facetscope.cache.evictions";
  static final String DURATION = "facetscope.investigation.duration";

  private final MeterRegistry registry;
  private final Counter evictions;
  private final Timer duration;

  public InvestigationMetrics(MeterRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    this.evictions = Counter.builder(CACHE_EVICTIONS)
      .description("Durable cache entries removed by retention")
      .register(registry);
    this.duration = Timer.builder(DURATION)
      .description("Time to complete an anomaly investigation")
      .register(registry);
  }

  /**
   * Metrics backed by a registry nobody scrapes, for when metrics are disabled.
   */
  public static InvestigationMetrics noop() {
    return new InvestigationMetrics(new SimpleMeterRegistry());
  }

  public MeterRegistry registry() {
    return registry;
  }

  /**
   * Counts an investigation by where its results came from (memory, durable, fresh).
   */
  public void recordInvestigation(String source) {
    registry.counter(INVESTIGATIONS, "source", source).increment();
  }

  public void recordFacetFailure(String facetId) {
    registry.counter(FACET_FAILURES, "facet", facetId).increment();
  }

  public void recordEvictions(int count) {
    if (count > 0) {
      evictions.increment(count);
    }
  }

  public void recordDuration(long nanos) {
    duration.record(nanos, TimeUnit.NANOSECONDS);
  }
}
