package io.github.themoah.facetscope;

import io.github.themoah.facetscope.analysis.FacetAnalyzer;
import io.github.themoah.facetscope.analysis.SelectionAnalyzer;
import io.github.themoah.facetscope.cache.DurableStore;
import io.github.themoah.facetscope.cache.FileDurableStore;
import io.github.themoah.facetscope.cache.InMemoryDurableStore;
import io.github.themoah.facetscope.cache.InvestigationCache;
import io.github.themoah.facetscope.clickhouse.AggregationExecutor;
import io.github.themoah.facetscope.clickhouse.ClickHouseAggregationExecutor;
import io.github.themoah.facetscope.clickhouse.ClickHouseConfig;
import io.github.themoah.facetscope.config.AppConfig;
import io.github.themoah.facetscope.config.InvestigationConfig;
import io.github.themoah.facetscope.context.QueryState;
import io.github.themoah.facetscope.health.ClickHouseHealthMonitor;
import io.github.themoah.facetscope.health.HealthCheckHandler;
import io.github.themoah.facetscope.http.InvestigationHandler;
import io.github.themoah.facetscope.investigation.InvestigationOrchestrator;
import io.github.themoah.facetscope.investigation.RenderedRows;
import io.github.themoah.facetscope.metrics.InvestigationMetrics;
import io.github.themoah.facetscope.metrics.MetricsConfig;
import io.github.themoah.facetscope.metrics.MicrometerConfig;
import io.github.themoah.facetscope.metrics.PrometheusHandler;
import io.github.themoah.facetscope.model.Breakdowns;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main verticle for Facetscope.
 * Wires the ClickHouse executor, investigation cache and orchestrator, health monitoring
 * and the HTTP server. All investigation state lives on this verticle's event loop.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);

  private AggregationExecutor executor;
  private ClickHouseHealthMonitor healthMonitor;
  private HttpServer httpServer;

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting Facetscope MainVerticle");

    AppConfig appConfig = AppConfig.fromEnvironment();
    MetricsConfig metricsConfig = MetricsConfig.fromEnvironment();
    InvestigationConfig investigationConfig = InvestigationConfig.fromEnvironment();
    ClickHouseConfig clickHouseConfig = loadClickHouseConfig();

    Router router = Router.router(vertx);
    InvestigationMetrics metrics = createMetrics(metricsConfig, router);

    executor = new ClickHouseAggregationExecutor(vertx, clickHouseConfig);
    healthMonitor = new ClickHouseHealthMonitor(vertx, executor, appConfig.healthCheckIntervalMs());
    new HealthCheckHandler(healthMonitor).registerRoutes(router);

    QueryState queryState = new QueryState(clickHouseConfig.getTable());
    RenderedRows renderedRows = new RenderedRows();
    InvestigationCache cache = new InvestigationCache(
      createDurableStore(investigationConfig), investigationConfig, Clock.systemUTC(), metrics);
    InvestigationOrchestrator orchestrator = new InvestigationOrchestrator(
      new FacetAnalyzer(executor, queryState, investigationConfig, clickHouseConfig.getDatabase(), metrics),
      new SelectionAnalyzer(executor, queryState, investigationConfig, clickHouseConfig.getDatabase(), metrics),
      cache,
      queryState,
      Breakdowns.investigated(),
      investigationConfig,
      metrics);
    orchestrator.setRenderableRows(renderedRows);
    new InvestigationHandler(orchestrator, queryState, renderedRows).registerRoutes(router);

    router.route().handler(ctx -> {
      ctx.response()
        .setStatusCode(404)
        .putHeader("content-type", "application/json")
        .end("{\"error\": \"Not Found\"}");
    });

    healthMonitor.start()
      .compose(v -> startHttpServer(router, appConfig.httpPort()))
      .onSuccess(server -> {
        httpServer = server;
        log.info("Facetscope started successfully on port {}", appConfig.httpPort());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start Facetscope", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping Facetscope MainVerticle");

    Future<Void> stopHealthMonitor = (healthMonitor != null)
      ? healthMonitor.stop()
      : Future.succeededFuture();

    stopHealthMonitor
      .compose(v -> httpServer != null ? httpServer.close() : Future.<Void>succeededFuture())
      .compose(v -> executor != null ? executor.close() : Future.<Void>succeededFuture())
      .onSuccess(v -> {
        log.info("Facetscope stopped successfully");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during Facetscope shutdown", err);
        stopPromise.fail(err);
      });
  }

  private Future<HttpServer> startHttpServer(Router router, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port)
      .onSuccess(server -> log.info("HTTP server started on port {}", port))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }

  private ClickHouseConfig loadClickHouseConfig() {
    try {
      return ClickHouseConfig.fromClasspath();
    } catch (Exception e) {
      log.info("No classpath config found, loading from environment: {}", e.getMessage());
      return ClickHouseConfig.fromEnvironment();
    }
  }

  private DurableStore createDurableStore(InvestigationConfig config) {
    if (config.useFileStore()) {
      return new FileDurableStore(Path.of(config.cacheDir()));
    }
    log.info("Using in-memory investigation cache");
    return new InMemoryDurableStore();
  }

  private InvestigationMetrics createMetrics(MetricsConfig config, Router router) {
    if (!config.isEnabled()) {
      log.info("Metrics reporting is disabled");
      return InvestigationMetrics.noop();
    }

    MeterRegistry registry = MicrometerConfig.createRegistry(config.reporterType());
    if (registry == null) {
      log.warn("Failed to create meter registry for type: {}", config.reporterType());
      return InvestigationMetrics.noop();
    }

    if (config.jvmMetricsEnabled()) {
      MicrometerConfig.bindJvmMetrics(registry);
      log.info("JVM metrics enabled");
    }

    if (registry instanceof PrometheusMeterRegistry prometheusRegistry) {
      new PrometheusHandler(prometheusRegistry).registerRoutes(router);
    }
    return new InvestigationMetrics(registry);
  }
}
