package io.github.themoah.facetscope.health;

import io.github.themoah.facetscope.clickhouse.AggregationException;
import io.github.themoah.facetscope.clickhouse.AggregationExecutor;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks ClickHouse reachability with a periodic {@code SELECT 1}.
 */
public class ClickHouseHealthMonitor {

  private static final Logger log = LoggerFactory.getLogger(ClickHouseHealthMonitor.class);

  private final Vertx vertx;
  private final AggregationExecutor executor;
  private final long intervalMs;
  private final AtomicReference<HealthStatus> status = new AtomicReference<>(HealthStatus.DOWN);

  private Long timerId;

  public ClickHouseHealthMonitor(Vertx vertx, AggregationExecutor executor, long intervalMs) {
    this.vertx = vertx;
    this.executor = executor;
    this.intervalMs = intervalMs;
  }

  /**
   * Runs a first check and schedules the periodic one. Completes even when ClickHouse is down.
   */
  public Future<Void> start() {
    log.info("Starting ClickHouse health monitor with interval: {}ms", intervalMs);
    return check()
      .onComplete(ar -> timerId = vertx.setPeriodic(intervalMs, id -> check()))
      .mapEmpty();
  }

  public Future<Void> stop() {
    log.info("Stopping ClickHouse health monitor");
    if (timerId != null) {
      vertx.cancelTimer(timerId);
      timerId = null;
    }
    status.set(HealthStatus.DOWN);
    return Future.succeededFuture();
  }

  public HealthStatus getStatus() {
    return status.get();
  }

  public boolean isReachable() {
    return status.get() == HealthStatus.UP;
  }

  Future<Void> check() {
    return executor.ping()
      .onSuccess(v -> {
        if (status.getAndSet(HealthStatus.UP) == HealthStatus.DOWN) {
          log.info("ClickHouse reachable");
        }
      })
      .onFailure(err -> {
        HealthStatus previous = status.getAndSet(HealthStatus.DOWN);
        if (err instanceof AggregationException ae && ae.isAuthenticationFailure()) {
          log.error("ClickHouse rejected credentials: {}", err.getMessage());
        } else if (previous == HealthStatus.UP) {
          log.warn("ClickHouse unreachable: {}", err.getMessage());
        } else {
          log.debug("ClickHouse health check failed: {}", err.getMessage());
        }
      })
      .recover(err -> Future.succeededFuture());
  }
}
