package io.github.themoah.facetscope.clickhouse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Tests ClickHouseAggregationExecutor against a local HTTP server standing in for ClickHouse.
 */
@ExtendWith(VertxExtension.class)
public class ClickHouseAggregationExecutorTest {

  private HttpServer server;

  @AfterEach
  void tearDown(VertxTestContext testContext) {
    if (server == null) {
      testContext.completeNow();
      return;
    }
    server.close().onComplete(testContext.succeedingThenComplete());
  }

  private void startServer(Vertx vertx, VertxTestContext testContext,
                           BiConsumer<HttpServerRequest, String> handler, Runnable onListening) {
    vertx.createHttpServer()
      .requestHandler(req -> req.body().onSuccess(body -> handler.accept(req, body.toString())))
      .listen(0)
      .onComplete(testContext.succeeding(s -> {
        server = s;
        onListening.run();
      }));
  }

  private ClickHouseConfig config() {
    return ClickHouseConfig.builder()
      .url("http://localhost:" + server.actualPort() + "/")
      .user("analyst")
      .password("secret")
      .requestTimeoutMs(5000)
      .queryCacheTtlSeconds(120)
      .build();
  }

  @Test
  void runAggregation_sendsQueryAndParsesRows(Vertx vertx, VertxTestContext testContext) {
    AtomicReference<HttpServerRequest> seen = new AtomicReference<>();
    AtomicReference<String> seenBody = new AtomicReference<>();
    JsonObject response = new JsonObject()
      .put("meta", new JsonArray())
      .put("data", new JsonArray()
        .add(new JsonObject().put("dim", "a.com").put("anomaly_cat_cnt", "50"))
        .add(new JsonObject().put("dim", "b.com").put("anomaly_cat_cnt", "5")))
      .put("rows", 2);

    startServer(vertx, testContext, (req, body) -> {
      seen.set(req);
      seenBody.set(body);
      req.response().putHeader("Content-Type", "application/json").end(response.encode());
    }, () -> {
      ClickHouseAggregationExecutor executor = new ClickHouseAggregationExecutor(vertx, config());
      executor.runAggregation("SELECT dim,\n    count() as cnt\n  FROM logs.requests")
        .onComplete(testContext.succeeding(rows -> testContext.verify(() -> {
          assertEquals(2, rows.size());
          assertEquals("a.com", rows.get(0).getString("dim"));

          HttpServerRequest req = seen.get();
          assertEquals("POST", req.method().name());
          assertEquals("1", req.getParam("use_query_cache"));
          assertEquals("120", req.getParam("query_cache_ttl"));
          assertEquals("save", req.getParam("query_cache_nondeterministic_function_handling"));
          String expectedAuth = "Basic " + Base64.getEncoder()
            .encodeToString("analyst:secret".getBytes(StandardCharsets.UTF_8));
          assertEquals(expectedAuth, req.getHeader("Authorization"));
          assertEquals("SELECT dim, count() as cnt FROM logs.requests FORMAT JSON", seenBody.get());
          executor.close();
          testContext.completeNow();
        })));
    });
  }

  @Test
  void runAggregation_errorStatusFails(Vertx vertx, VertxTestContext testContext) {
    startServer(vertx, testContext,
      (req, body) -> req.response().setStatusCode(500).end("Code: 62. DB::Exception: Syntax error"),
      () -> new ClickHouseAggregationExecutor(WebClient.create(vertx), config())
        .runAggregation("SELEC 1")
        .onComplete(testContext.failing(err -> testContext.verify(() -> {
          AggregationException ae = assertInstanceOf(AggregationException.class, err);
          assertEquals(500, ae.statusCode());
          assertTrue(ae.getMessage().contains("Syntax error"));
          testContext.completeNow();
        }))));
  }

  @Test
  void ping_reportsRejectedCredentials(Vertx vertx, VertxTestContext testContext) {
    startServer(vertx, testContext,
      (req, body) -> req.response().setStatusCode(401).end("Code: 516. Authentication failed"),
      () -> new ClickHouseAggregationExecutor(vertx, config())
        .ping()
        .onComplete(testContext.failing(err -> testContext.verify(() -> {
          assertTrue(((AggregationException) err).isAuthenticationFailure());
          testContext.completeNow();
        }))));
  }

  @Test
  void rows_missingDataIsEmpty() {
    assertTrue(ClickHouseAggregationExecutor.rows(new JsonObject().put("rows", 0)).isEmpty());
    assertTrue(ClickHouseAggregationExecutor.rows(null).isEmpty());
  }

  @Test
  void normalize_collapsesWhitespace() {
    assertEquals("SELECT 1 FROM t WHERE a = 'x'",
      ClickHouseAggregationExecutor.normalize("  SELECT 1\n\tFROM t\n  WHERE a = 'x'\n"));
  }
}
