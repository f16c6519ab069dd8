package io.github.themoah.facetscope.clickhouse;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs aggregations through the ClickHouse HTTP interface using the Vert.x WebClient.
 * Queries are sent with the server-side query cache enabled, since investigation queries
 * use fixed timestamps and repeat verbatim.
 */
public class ClickHouseAggregationExecutor implements AggregationExecutor {

  private static final Logger log = LoggerFactory.getLogger(ClickHouseAggregationExecutor.class);

  private final WebClient client;
  private final ClickHouseConfig config;

  /**
   * Creates a new ClickHouseAggregationExecutor.
   *
   * @param vertx  the Vert.x instance
   * @param config the ClickHouse configuration
   */
  public ClickHouseAggregationExecutor(Vertx vertx, ClickHouseConfig config) {
    Objects.requireNonNull(vertx, "vertx cannot be null");
    this.config = Objects.requireNonNull(config, "config cannot be null");
    log.info("Creating ClickHouse client for {}", config.getUrl());
    this.client = WebClient.create(vertx, new WebClientOptions()
      .setConnectTimeout(config.getRequestTimeoutMs()));
  }

  /**
   * Creates a new ClickHouseAggregationExecutor with an existing client (for testing).
   */
  ClickHouseAggregationExecutor(WebClient client, ClickHouseConfig config) {
    this.client = Objects.requireNonNull(client, "client cannot be null");
    this.config = Objects.requireNonNull(config, "config cannot be null");
  }

  @Override
  public Future<List<JsonObject>> runAggregation(String sql) {
    Objects.requireNonNull(sql, "sql cannot be null");
    String body = normalize(sql) + " FORMAT JSON";
    long started = System.nanoTime();

    return client.postAbs(config.getUrl())
      .addQueryParam("use_query_cache", "1")
      .addQueryParam("query_cache_ttl", String.valueOf(config.getQueryCacheTtlSeconds()))
      .addQueryParam("query_cache_nondeterministic_function_handling", "save")
      .basicAuthentication(config.getUser(), config.getPassword())
      .timeout(config.getRequestTimeoutMs())
      .sendBuffer(Buffer.buffer(body))
      .recover(err -> Future.failedFuture(
        new AggregationException("ClickHouse request failed: " + err.getMessage(), err)))
      .compose(this::parseResponse)
      .onSuccess(rows -> log.debug("Aggregation returned {} rows in {}ms",
        rows.size(), (System.nanoTime() - started) / 1_000_000))
      .onFailure(err -> log.debug("Aggregation failed: {}", err.getMessage()));
  }

  @Override
  public Future<Void> close() {
    log.info("Closing ClickHouse client");
    client.close();
    return Future.succeededFuture();
  }

  private Future<List<JsonObject>> parseResponse(HttpResponse<Buffer> response) {
    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      String text = response.bodyAsString();
      return Future.failedFuture(new AggregationException(text == null ? "" : text, response.statusCode()));
    }
    try {
      return Future.succeededFuture(rows(response.bodyAsJsonObject()));
    } catch (DecodeException | ClassCastException e) {
      return Future.failedFuture(new AggregationException("Unparsable ClickHouse response", e));
    }
  }

  static List<JsonObject> rows(JsonObject body) {
    List<JsonObject> rows = new ArrayList<>();
    if (body == null) {
      return rows;
    }
    JsonArray data = body.getJsonArray("data");
    if (data == null) {
      return rows;
    }
    for (int i = 0; i < data.size(); i++) {
      rows.add(data.getJsonObject(i));
    }
    return rows;
  }

  /**
   * Collapses whitespace so equivalent queries hit the same server-side cache entry.
   */
  static String normalize(String sql) {
    return sql.replaceAll("\\s+", " ").trim();
  }
}
