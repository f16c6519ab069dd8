package io.github.themoah.facetscope.metrics;

import io.github.themoah.facetscope.config.EnvValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics configuration loaded from environment variables.
 *
 * @param enabled whether metrics are recorded and exposed
 * @param reporterType registry type, only "prometheus" is supported
 * @param jvmMetricsEnabled whether JVM binders are attached
 */
public record MetricsConfig(
  boolean enabled,
  String reporterType,
  boolean jvmMetricsEnabled
) {
  private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

  private static final String DEFAULT_REPORTER = "prometheus";

  public boolean isEnabled() {
    return enabled;
  }

  public static MetricsConfig fromEnvironment() {
    boolean enabled = EnvValues.getBoolean("METRICS_ENABLED", true);
    String reporter = EnvValues.getString("METRICS_REPORTER", DEFAULT_REPORTER);
    boolean jvm = EnvValues.getBoolean("METRICS_JVM_ENABLED", false);

    log.info("MetricsConfig loaded: enabled={}, reporter={}, jvmMetrics={}", enabled, reporter, jvm);
    return new MetricsConfig(enabled, reporter, jvm);
  }
}
