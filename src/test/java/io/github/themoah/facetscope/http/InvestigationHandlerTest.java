package io.github.themoah.facetscope.http;

import static io.github.themoah.facetscope.clickhouse.FakeAggregationExecutor.aggregates;
import static io.github.themoah.facetscope.clickhouse.FakeAggregationExecutor.anomalyRow;
import static io.github.themoah.facetscope.clickhouse.FakeAggregationExecutor.selectionRow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.facetscope.analysis.FacetAnalyzer;
import io.github.themoah.facetscope.analysis.SelectionAnalyzer;
import io.github.themoah.facetscope.cache.InMemoryDurableStore;
import io.github.themoah.facetscope.cache.InvestigationCache;
import io.github.themoah.facetscope.clickhouse.FakeAggregationExecutor;
import io.github.themoah.facetscope.config.InvestigationConfig;
import io.github.themoah.facetscope.context.QueryState;
import io.github.themoah.facetscope.investigation.InvestigationOrchestrator;
import io.github.themoah.facetscope.investigation.RenderedRows;
import io.github.themoah.facetscope.metrics.InvestigationMetrics;
import io.github.themoah.facetscope.model.Breakdowns;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Exercises the investigation routes over HTTP with a fake ClickHouse executor.
 */
@ExtendWith(VertxExtension.class)
public class InvestigationHandlerTest {

  private static final String BASE = "/api/investigations";

  private FakeAggregationExecutor executor;
  private QueryState state;
  private WebClient client;
  private int port;

  @BeforeEach
  void setUp(Vertx vertx, VertxTestContext testContext) {
    executor = new FakeAggregationExecutor().respondWith(sql -> {
      if (sql.contains("selection_cnt")) {
        return aggregates(sql, "`request.host`")
          ? List.of(selectionRow("a.com", 100, 100, 50, 0), selectionRow("b.com", 100, 900, 0, 0))
          : List.of();
      }
      if (aggregates(sql, "`request.host`")) {
        return List.of(anomalyRow("a.com", 50, 10, 60, 1000), anomalyRow("b.com", 5, 200, 500, 5000));
      }
      return List.of(anomalyRow("/x", 40, 0, 40, 0), anomalyRow("/z", 20, 0, 20, 0));
    });

    InvestigationConfig config = InvestigationConfig.defaults();
    InvestigationMetrics metrics = InvestigationMetrics.noop();
    state = new QueryState("requests");
    RenderedRows rendered = new RenderedRows();
    InvestigationOrchestrator orchestrator = new InvestigationOrchestrator(
      new FacetAnalyzer(executor, state, config, "logs", metrics),
      new SelectionAnalyzer(executor, state, config, "logs", metrics),
      new InvestigationCache(new InMemoryDurableStore(), config),
      state,
      List.of(Breakdowns.HOSTS, Breakdowns.PATHS),
      config,
      metrics);
    orchestrator.setRenderableRows(rendered);

    Router router = Router.router(vertx);
    new InvestigationHandler(orchestrator, state, rendered).registerRoutes(router);
    client = WebClient.create(vertx);

    vertx.createHttpServer().requestHandler(router).listen(0)
      .onComplete(testContext.succeeding(server -> {
        port = server.actualPort();
        testContext.completeNow();
      }));
  }

  private static JsonObject investigateBody() {
    return new JsonObject()
      .put("anomalies", new JsonArray().add(new JsonObject()
        .put("rank", 1)
        .put("category", "red")
        .put("type", "spike")
        .put("startTime", "2025-01-01T10:00:00Z")
        .put("endTime", "2025-01-01T10:05:00Z")
        .put("magnitude", 4.2)))
      .put("chartData", new JsonArray()
        .add(new JsonObject().put("t", "2025-01-01T10:00:00Z").put("cnt_5xx", 3))
        .add(new JsonObject().put("t", "2025-01-01T11:00:00Z").put("cnt_5xx", 1)))
      .put("context", new JsonObject()
        .put("timeRange", "1h")
        .put("queryTimestamp", "2025-01-01T11:00:00Z"));
  }

  private Future<HttpResponse<Buffer>> investigate() {
    return client.post(port, "localhost", BASE).sendJsonObject(investigateBody());
  }

  @Test
  void investigate_thenLookups(VertxTestContext testContext) {
    investigate()
      .compose(first -> {
        JsonObject body = first.bodyAsJsonObject();
        testContext.verify(() -> {
          assertEquals(200, first.statusCode());
          assertEquals("fresh", body.getString("source"));
          assertEquals(1, body.getJsonArray("results").size());
          JsonObject contributor = body.getJsonArray("results").getJsonObject(0)
            .getJsonObject("facets").getJsonArray("breakdown-hosts").getJsonObject(0);
          assertEquals("a.com", contributor.getString("dim"));
          assertEquals(86.1, contributor.getDouble("shareChange"));
          assertEquals(new JsonObject().put("facetId", "breakdown-hosts").put("dim", "a.com"),
            body.getJsonArray("highlights").getJsonObject(0));
        });
        return client.get(port, "localhost", BASE + "/rank/1").send();
      })
      .compose(byRank -> {
        String anomalyId = byRank.bodyAsJsonObject().getString("anomalyId");
        testContext.verify(() -> {
          assertEquals(200, byRank.statusCode());
          assertNotNull(anomalyId);
        });
        return client.get(port, "localhost", BASE + "/" + anomalyId).send();
      })
      .compose(byId -> {
        testContext.verify(() -> {
          assertEquals(200, byId.statusCode());
          assertEquals("COMPLETE", byId.bodyAsJsonObject().getString("state"));
        });
        return client.get(port, "localhost", BASE + "/highlights").addQueryParam("facet", "breakdown-hosts").send();
      })
      .compose(dims -> {
        testContext.verify(() ->
          assertEquals(new JsonArray().add("a.com"), dims.bodyAsJsonObject().getJsonArray("dims")));
        return investigate();
      })
      .onComplete(testContext.succeeding(second -> testContext.verify(() -> {
        assertEquals("memory", second.bodyAsJsonObject().getString("source"));
        assertEquals(2, executor.callCount());
        testContext.completeNow();
      })));
  }

  @Test
  void investigate_rejectsMalformedBody(VertxTestContext testContext) {
    client.post(port, "localhost", BASE).sendJsonObject(new JsonObject().put("anomalies", "none"))
      .compose(bad -> {
        testContext.verify(() -> {
          assertEquals(400, bad.statusCode());
          assertTrue(bad.bodyAsJsonObject().getString("error").contains("anomalies"));
        });
        return client.post(port, "localhost", BASE).sendBuffer(Buffer.buffer("{not json"));
      })
      .onComplete(testContext.succeeding(invalid -> testContext.verify(() -> {
        assertEquals(400, invalid.statusCode());
        assertEquals(0, executor.callCount());
        testContext.completeNow();
      })));
  }

  @Test
  void investigate_rejectedRequestLeavesQueryStateAlone(VertxTestContext testContext) {
    String hostBefore = state.hostFilter();
    JsonObject context = new JsonObject()
      .put("host", "cdn.example.com")
      .put("filters", new JsonArray().add(new JsonObject().put("column", "`cdn.datacenter`").put("value", "FRA")));
    JsonObject nullPoint = investigateBody().put("context", context);
    nullPoint.getJsonArray("chartData").addNull();

    client.post(port, "localhost", BASE).sendJsonObject(nullPoint)
      .compose(bad -> {
        testContext.verify(() -> {
          assertEquals(400, bad.statusCode());
          assertTrue(bad.bodyAsJsonObject().getString("error").contains("chart point"));
          assertEquals(hostBefore, state.hostFilter());
          assertTrue(state.filters().isEmpty());
        });
        JsonObject badAnomaly = investigateBody().put("context", context);
        badAnomaly.getJsonArray("anomalies").getJsonObject(0).put("startTime", "yesterday");
        return client.post(port, "localhost", BASE).sendJsonObject(badAnomaly);
      })
      .onComplete(testContext.succeeding(bad -> testContext.verify(() -> {
        assertEquals(400, bad.statusCode());
        assertEquals(hostBefore, state.hostFilter());
        assertTrue(state.filters().isEmpty());
        assertEquals(0, executor.callCount());
        testContext.completeNow();
      })));
  }

  @Test
  void noAnomalies_returnsNone(VertxTestContext testContext) {
    JsonObject body = investigateBody().put("anomalies", new JsonArray());
    client.post(port, "localhost", BASE).sendJsonObject(body)
      .onComplete(testContext.succeeding(resp -> testContext.verify(() -> {
        assertEquals(200, resp.statusCode());
        assertEquals("none", resp.bodyAsJsonObject().getString("source"));
        assertTrue(resp.bodyAsJsonObject().getJsonArray("highlights").isEmpty());
        testContext.completeNow();
      })));
  }

  @Test
  void unknownItems_return404(VertxTestContext testContext) {
    client.get(port, "localhost", BASE + "/nobody-knows-me").send()
      .compose(unknown -> {
        testContext.verify(() -> assertEquals(404, unknown.statusCode()));
        return client.get(port, "localhost", BASE + "/rank/7").send();
      })
      .compose(noRank -> {
        testContext.verify(() -> assertEquals(404, noRank.statusCode()));
        return client.get(port, "localhost", BASE + "/rank/first").send();
      })
      .onComplete(testContext.succeeding(badRank -> testContext.verify(() -> {
        assertEquals(400, badRank.statusCode());
        testContext.completeNow();
      })));
  }

  @Test
  void highlightedDimensions_validatesFacet(VertxTestContext testContext) {
    client.get(port, "localhost", BASE + "/highlights").send()
      .compose(missing -> {
        testContext.verify(() -> assertEquals(400, missing.statusCode()));
        return client.get(port, "localhost", BASE + "/highlights").addQueryParam("facet", "breakdown-colors").send();
      })
      .onComplete(testContext.succeeding(unknown -> testContext.verify(() -> {
        assertEquals(404, unknown.statusCode());
        testContext.completeNow();
      })));
  }

  @Test
  void renderableRows_reapplyHighlights(VertxTestContext testContext) {
    investigate()
      .compose(v -> client.put(port, "localhost", BASE + "/renderable")
        .sendJsonObject(new JsonObject().put("breakdown-hosts", new JsonArray().add("A.COM"))))
      .onComplete(testContext.succeeding(resp -> testContext.verify(() -> {
        assertEquals(200, resp.statusCode());
        assertEquals(new JsonArray().add(new JsonObject().put("facetId", "breakdown-hosts").put("dim", "A.COM")),
          resp.bodyAsJsonObject().getJsonArray("highlights"));
        testContext.completeNow();
      })));
  }

  @Test
  void deleteCache_clearsDurableOnRequest(VertxTestContext testContext) {
    investigate()
      .compose(v -> client.get(port, "localhost", BASE + "/cache").send())
      .compose(status -> {
        testContext.verify(() -> assertTrue(status.bodyAsJsonObject().getBoolean("cached")));
        return client.delete(port, "localhost", BASE + "/cache").addQueryParam("durable", "true").send();
      })
      .compose(deleted -> {
        testContext.verify(() -> {
          assertTrue(deleted.bodyAsJsonObject().getBoolean("invalidated"));
          assertEquals(1, deleted.bodyAsJsonObject().getInteger("durableRemoved"));
        });
        return client.get(port, "localhost", BASE + "/cache").send();
      })
      .onComplete(testContext.succeeding(status -> testContext.verify(() -> {
        assertFalse(status.bodyAsJsonObject().getBoolean("cached"));
        testContext.completeNow();
      })));
  }

  @Test
  void selection_returnsContributorsAndHighlights(VertxTestContext testContext) {
    JsonObject body = new JsonObject()
      .put("selectionStart", "2025-01-01T10:00:00Z")
      .put("selectionEnd", "2025-01-01T10:10:00Z")
      .put("fullStart", "2025-01-01T10:00:00Z")
      .put("fullEnd", "2025-01-01T11:00:00Z");

    client.post(port, "localhost", BASE + "/selection").sendJsonObject(body)
      .compose(resp -> {
        testContext.verify(() -> {
          assertEquals(200, resp.statusCode());
          JsonArray contributors = resp.bodyAsJsonObject().getJsonArray("contributors");
          assertEquals(2, contributors.size());
          assertEquals("a.com", contributors.getJsonObject(0).getString("dim"));
          assertEquals("blue", contributors.getJsonObject(0).getString("category"));
          assertEquals(-40.0, contributors.getJsonObject(1).getDouble("shareChange"));
          assertEquals(2, resp.bodyAsJsonObject().getJsonArray("highlights").size());
        });
        return client.post(port, "localhost", BASE + "/selection")
          .sendJsonObject(body.copy().put("selectionEnd", "2025-01-01T09:00:00Z"));
      })
      .onComplete(testContext.succeeding(bad -> testContext.verify(() -> {
        assertEquals(400, bad.statusCode());
        testContext.completeNow();
      })));
  }
}
