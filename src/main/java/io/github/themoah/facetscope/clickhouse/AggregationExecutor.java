package io.github.themoah.facetscope.clickhouse;

import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import java.util.List;

/**
 * Runs aggregation queries against the log store.
 * All methods return Vert.x Futures for async, non-blocking execution.
 */
public interface AggregationExecutor {

  /**
   * Runs an aggregation query.
   *
   * @param sql the query, without a FORMAT clause
   * @return Future containing the result rows; fails with {@link AggregationException} when the call fails
   */
  Future<List<JsonObject>> runAggregation(String sql);

  /**
   * Lightweight round trip used by the readiness check.
   *
   * @return Future that succeeds when the store answers
   */
  default Future<Void> ping() {
    return runAggregation("SELECT 1").mapEmpty();
  }

  /**
   * Releases underlying resources.
   *
   * @return Future that completes when closed
   */
  default Future<Void> close() {
    return Future.succeededFuture();
  }
}
