package io.github.themoah.facetscope.http;

import io.github.themoah.facetscope.context.QueryState;
import io.github.themoah.facetscope.investigation.InvestigationOrchestrator;
import io.github.themoah.facetscope.investigation.RenderedRows;
import io.github.themoah.facetscope.model.Anomaly;
import io.github.themoah.facetscope.model.Breakdowns;
import io.github.themoah.facetscope.model.ChartPoint;
import io.github.themoah.facetscope.model.HighlightKey;
import io.github.themoah.facetscope.model.SelectionContributor;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP API over the investigation orchestrator.
 */
public class InvestigationHandler {

  private static final Logger log = LoggerFactory.getLogger(InvestigationHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";
  private static final String BASE = "/api/investigations";

  private final InvestigationOrchestrator orchestrator;
  private final QueryState state;
  private final RenderedRows renderedRows;

  public InvestigationHandler(InvestigationOrchestrator orchestrator, QueryState state, RenderedRows renderedRows) {
    this.orchestrator = orchestrator;
    this.state = state;
    this.renderedRows = renderedRows;
  }

  public void registerRoutes(Router router) {
    router.route(BASE + "*").handler(BodyHandler.create());
    router.post(BASE).handler(this::handleInvestigate);
    router.post(BASE + "/selection").handler(this::handleSelection);
    router.get(BASE + "/highlights").handler(this::handleHighlightedDimensions);
    router.post(BASE + "/highlights/reapply").handler(this::handleReapply);
    router.get(BASE + "/cache").handler(this::handleCacheStatus);
    router.delete(BASE + "/cache").handler(this::handleInvalidate);
    router.put(BASE + "/renderable").handler(this::handleRenderable);
    router.get(BASE + "/rank/:rank").handler(this::handleByRank);
    router.get(BASE + "/:anomalyId").handler(this::handleByAnomalyId);
    log.info("Investigation routes registered under {}", BASE);
  }

  private void handleInvestigate(RoutingContext ctx) {
    List<Anomaly> anomalies;
    List<ChartPoint> chartData;
    Consumer<QueryState> context;
    try {
      JsonObject body = bodyOf(ctx);
      anomalies = InvestigationRequests.anomalies(body);
      chartData = InvestigationRequests.chartData(body);
      context = InvestigationRequests.context(body);
    } catch (IllegalArgumentException | ClassCastException | DecodeException e) {
      badRequest(ctx, e);
      return;
    }

    context.accept(state);
    orchestrator.investigate(anomalies, chartData)
      .onSuccess(outcome -> json(ctx, 200, outcome.toJson()
        .put("highlights", highlightsJson(orchestrator.currentHighlights()))))
      .onFailure(err -> serverError(ctx, err));
  }

  private void handleSelection(RoutingContext ctx) {
    try {
      JsonObject body = bodyOf(ctx);
      orchestrator.investigateSelection(
          InvestigationRequests.window(body, "selectionStart", "selectionEnd"),
          InvestigationRequests.window(body, "fullStart", "fullEnd"))
        .onSuccess(contributors -> {
          JsonArray array = new JsonArray();
          contributors.stream().map(SelectionContributor::toJson).forEach(array::add);
          json(ctx, 200, new JsonObject()
            .put("contributors", array)
            .put("highlights", highlightsJson(orchestrator.currentSelectionHighlights())));
        })
        .onFailure(err -> serverError(ctx, err));
    } catch (IllegalArgumentException | ClassCastException | DecodeException e) {
      badRequest(ctx, e);
    }
  }

  private void handleHighlightedDimensions(RoutingContext ctx) {
    String facet = ctx.queryParams().get("facet");
    if (facet == null || facet.isBlank()) {
      error(ctx, 400, "Query parameter 'facet' is required");
      return;
    }
    if (Breakdowns.byId(facet).isEmpty()) {
      error(ctx, 404, "Unknown facet: " + facet);
      return;
    }
    json(ctx, 200, new JsonObject()
      .put("facet", facet)
      .put("dims", new JsonArray(List.copyOf(orchestrator.getHighlightedDimensions(facet)))));
  }

  private void handleReapply(RoutingContext ctx) {
    json(ctx, 200, new JsonObject().put("highlights", highlightsJson(orchestrator.reapplyHighlights())));
  }

  private void handleCacheStatus(RoutingContext ctx) {
    json(ctx, 200, new JsonObject().put("cached", orchestrator.hasCachedInvestigation()));
  }

  private void handleInvalidate(RoutingContext ctx) {
    orchestrator.invalidateCache();
    JsonObject response = new JsonObject().put("invalidated", true);
    if ("true".equalsIgnoreCase(ctx.queryParams().get("durable"))) {
      response.put("durableRemoved", orchestrator.clearDurableCache());
    }
    json(ctx, 200, response);
  }

  private void handleRenderable(RoutingContext ctx) {
    try {
      renderedRows.replaceAll(InvestigationRequests.renderedRows(bodyOf(ctx)));
      json(ctx, 200, new JsonObject().put("highlights", highlightsJson(orchestrator.reapplyHighlights())));
    } catch (IllegalArgumentException | DecodeException e) {
      badRequest(ctx, e);
    }
  }

  private void handleByRank(RoutingContext ctx) {
    int rank;
    try {
      rank = Integer.parseInt(ctx.pathParam("rank"));
    } catch (NumberFormatException e) {
      error(ctx, 400, "Rank must be an integer");
      return;
    }
    orchestrator.getAnomalyIdByRank(rank).ifPresentOrElse(
      id -> json(ctx, 200, new JsonObject().put("rank", rank).put("anomalyId", id)),
      () -> error(ctx, 404, "No anomaly with rank " + rank));
  }

  private void handleByAnomalyId(RoutingContext ctx) {
    String anomalyId = ctx.pathParam("anomalyId");
    orchestrator.getResultByAnomalyId(anomalyId).ifPresentOrElse(
      result -> json(ctx, 200, result.toJson()),
      () -> error(ctx, 404, "Unknown anomaly: " + anomalyId));
  }

  private static JsonObject bodyOf(RoutingContext ctx) {
    JsonObject body = ctx.body().asJsonObject();
    if (body == null) {
      throw new IllegalArgumentException("Request body must be a JSON object");
    }
    return body;
  }

  static JsonArray highlightsJson(Collection<HighlightKey> highlights) {
    JsonArray array = new JsonArray();
    highlights.forEach(h -> array.add(new JsonObject().put("facetId", h.facetId()).put("dim", h.dim())));
    return array;
  }

  private static void json(RoutingContext ctx, int status, JsonObject body) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(status)
      .end(body.encode());
  }

  private static void error(RoutingContext ctx, int status, String message) {
    json(ctx, status, new JsonObject().put("error", message));
  }

  private static void badRequest(RoutingContext ctx, Exception e) {
    log.debug("Rejected request to {}: {}", ctx.request().path(), e.getMessage());
    error(ctx, 400, e.getMessage());
  }

  private static void serverError(RoutingContext ctx, Throwable err) {
    log.error("Investigation request to {} failed", ctx.request().path(), err);
    error(ctx, 500, "Internal error");
  }
}
