package io.github.themoah.facetscope.health;

import io.vertx.core.json.JsonObject;

/**
 * Health check response body.
 *
 * @param status overall health status
 * @param clickhouse ClickHouse reachability (null for liveness)
 */
public record HealthCheckResponse(
  HealthStatus status,
  String clickhouse
) {

  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(HealthStatus.UP, null);
  }

  /**
   * Readiness depends on ClickHouse answering the periodic probe.
   */
  public static HealthCheckResponse readiness(boolean clickhouseReachable) {
    HealthStatus status = clickhouseReachable ? HealthStatus.UP : HealthStatus.DOWN;
    String clickhouse = clickhouseReachable ? "reachable" : "unreachable";
    return new HealthCheckResponse(status, clickhouse);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.getValue());
    if (clickhouse != null) {
      json.put("clickhouse", clickhouse);
    }
    return json;
  }
}
