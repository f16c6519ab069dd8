package io.github.themoah.facetscope.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application configuration loaded from environment variables.
 *
 * @param httpPort HTTP server port
 * @param healthCheckIntervalMs ClickHouse health check interval in milliseconds
 */
public record AppConfig(
  int httpPort,
  long healthCheckIntervalMs
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  private static final int DEFAULT_HTTP_PORT = 8888;
  private static final long DEFAULT_HEALTH_CHECK_INTERVAL_MS = 30_000L;

  public static AppConfig fromEnvironment() {
    int port = EnvValues.getInt("HTTP_PORT", DEFAULT_HTTP_PORT);
    long interval = EnvValues.getLong("CLICKHOUSE_HEALTH_CHECK_INTERVAL_MS", DEFAULT_HEALTH_CHECK_INTERVAL_MS);

    log.info("AppConfig loaded: httpPort={}, healthCheckIntervalMs={}", port, interval);
    return new AppConfig(port, interval);
  }
}
