package io.github.themoah.facetscope.investigation;

import io.github.themoah.facetscope.analysis.FacetAnalyzer;
import io.github.themoah.facetscope.analysis.SelectionAnalyzer;
import io.github.themoah.facetscope.cache.CacheEntry;
import io.github.themoah.facetscope.cache.InvestigationCache;
import io.github.themoah.facetscope.cache.MemoryEntry;
import io.github.themoah.facetscope.config.InvestigationConfig;
import io.github.themoah.facetscope.context.QueryContext;
import io.github.themoah.facetscope.context.QueryContextProvider;
import io.github.themoah.facetscope.context.QuerySnapshot;
import io.github.themoah.facetscope.id.AnomalyIdGenerator;
import io.github.themoah.facetscope.investigation.InvestigationOutcome.Source;
import io.github.themoah.facetscope.metrics.InvestigationMetrics;
import io.github.themoah.facetscope.model.Anomaly;
import io.github.themoah.facetscope.model.Breakdown;
import io.github.themoah.facetscope.model.ChartPoint;
import io.github.themoah.facetscope.model.Contributor;
import io.github.themoah.facetscope.model.HighlightKey;
import io.github.themoah.facetscope.model.InvestigationResult;
import io.github.themoah.facetscope.model.SelectionContributor;
import io.github.themoah.facetscope.model.TimeWindow;
import io.vertx.core.Future;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs anomaly investigations for the session: reuses the memory or durable cache tier
 * when their results are eligible and can fill the highlight budget, otherwise analyzes
 * every anomaly against every investigated facet and caches the outcome.
 *
 * <p>Must be called from a single event loop. Facet analyses of one anomaly run
 * concurrently, anomalies run one after another, and highlights are recomputed as each
 * facet resolves.
 */
public class InvestigationOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(InvestigationOrchestrator.class);

  private final FacetAnalyzer facetAnalyzer;
  private final SelectionAnalyzer selectionAnalyzer;
  private final InvestigationCache cache;
  private final QueryContextProvider context;
  private final List<Breakdown> breakdowns;
  private final InvestigationMetrics metrics;
  private final int budget;
  private final int cacheTopN;
  private final InvestigationSession session = new InvestigationSession();

  private RenderableRows renderable = RenderableRows.ALL;

  public InvestigationOrchestrator(FacetAnalyzer facetAnalyzer, SelectionAnalyzer selectionAnalyzer,
                                   InvestigationCache cache, QueryContextProvider context,
                                   List<Breakdown> breakdowns, InvestigationConfig config,
                                   InvestigationMetrics metrics) {
    this.facetAnalyzer = Objects.requireNonNull(facetAnalyzer, "facetAnalyzer cannot be null");
    this.selectionAnalyzer = Objects.requireNonNull(selectionAnalyzer, "selectionAnalyzer cannot be null");
    this.cache = Objects.requireNonNull(cache, "cache cannot be null");
    this.context = Objects.requireNonNull(context, "context cannot be null");
    this.breakdowns = List.copyOf(breakdowns);
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    this.budget = config.highlightTopN();
    this.cacheTopN = config.cacheTopN();
  }

  public void setRenderableRows(RenderableRows renderable) {
    this.renderable = Objects.requireNonNull(renderable, "renderable cannot be null");
  }

  /**
   * Investigates the given anomalies in the current query context.
   *
   * @param anomalies detected anomalies, may be empty
   * @param chartData the visible series; first and last points bound the analysis window
   * @return Future with the results and the tier that produced them
   */
  public Future<InvestigationOutcome> investigate(List<Anomaly> anomalies, List<ChartPoint> chartData) {
    long epoch = session.nextEpoch();
    if (anomalies == null || anomalies.isEmpty()) {
      session.clearHighlights();
      return Future.succeededFuture(InvestigationOutcome.none());
    }

    long started = System.nanoTime();
    QuerySnapshot query = QuerySnapshot.of(context);
    String cacheKey = AnomalyIdGenerator.cacheKey(query.timeFilter(), query.hostFilter());
    QueryContext current = query.snapshot();
    log.debug("Investigation cache key: {}", cacheKey);

    Optional<InvestigationOutcome> cached = fromMemory(cacheKey, current)
      .or(() -> fromDurable(cacheKey, current));
    if (cached.isPresent()) {
      return Future.succeededFuture(record(cached.get(), started));
    }

    return investigateFresh(anomalies, chartData, cacheKey, query, epoch)
      .map(outcome -> record(outcome, started));
  }

  private Optional<InvestigationOutcome> fromMemory(String cacheKey, QueryContext current) {
    Optional<MemoryEntry> memory = cache.memory();
    if (memory.isEmpty() || !memory.get().key().equals(cacheKey) || memory.get().results().isEmpty()) {
      return Optional.empty();
    }
    MemoryEntry entry = memory.get();
    if (entry.context() == null || !QueryContext.isEligible(current, entry.context())) {
      log.debug("Memory cache key matches but context changed, checking durable cache");
      return Optional.empty();
    }
    session.restore(entry.results());
    session.cachedTopContributors(entry.topContributors());

    int highlighted = applyCached(entry.topContributors(), entry.results());
    if (highlighted >= budget) {
      log.info("Memory cache sufficient: {}/{} highlighted", highlighted, budget);
      return Optional.of(new InvestigationOutcome(entry.results(), Source.MEMORY));
    }
    log.info("Only {}/{} highlighted from memory cache, fetching fresh candidates", highlighted, budget);
    cache.clearMemory();
    return Optional.empty();
  }

  private Optional<InvestigationOutcome> fromDurable(String cacheKey, QueryContext current) {
    Optional<CacheEntry> loaded = cache.loadDurable(cacheKey, current);
    if (loaded.isEmpty()) {
      return Optional.empty();
    }
    CacheEntry entry = loaded.get();
    session.restore(entry.results());
    session.cachedTopContributors(entry.topContributors());
    cache.remember(new MemoryEntry(
      cacheKey,
      entry.results(),
      entry.context() != null ? entry.context() : current,
      entry.topContributors()));

    int highlighted = applyCached(entry.topContributors(), entry.results());
    if (highlighted >= budget) {
      log.info("Durable cache sufficient: {}/{} highlighted, skipping fresh investigation", highlighted, budget);
      return Optional.of(new InvestigationOutcome(entry.results(), Source.DURABLE));
    }
    log.info("Only {}/{} highlighted from durable cache, fetching fresh candidates", highlighted, budget);
    cache.clearMemory();
    return Optional.empty();
  }

  /**
   * Applies cached contributors, or every result for entries without them.
   * Entries without contributors count as filling the budget.
   *
   * @return number of highlights achieved
   */
  private int applyCached(List<Contributor> topContributors, List<InvestigationResult> results) {
    if (!topContributors.isEmpty()) {
      session.highlights(HighlightSelector.select(topContributors, renderable, context.focusedAnomalyId(), budget));
      return session.highlights().size();
    }
    session.highlights(highlightAll(results));
    return budget;
  }

  private Set<HighlightKey> highlightAll(List<InvestigationResult> results) {
    String focused = context.focusedAnomalyId();
    Set<HighlightKey> keys = new LinkedHashSet<>();
    for (InvestigationResult result : results) {
      if (focused != null && !focused.equals(result.anomalyId())) {
        continue;
      }
      for (Contributor c : result.allContributors()) {
        renderable.findRow(c.facetId(), c.dim()).ifPresent(row -> keys.add(new HighlightKey(c.facetId(), row)));
      }
    }
    return keys;
  }

  private Future<InvestigationOutcome> investigateFresh(List<Anomaly> anomalies, List<ChartPoint> chartData,
                                                        String cacheKey, QuerySnapshot query, long epoch) {
    session.resetForFresh();

    if (chartData == null || chartData.size() < 2) {
      log.info("No chart data for investigation");
      return Future.succeededFuture(InvestigationOutcome.none());
    }
    TimeWindow window = new TimeWindow(chartData.get(0).t(), chartData.get(chartData.size() - 1).t());
    String baseTimeRange = query.timeFilter();
    String baseFilters = query.facetFilterSql();
    log.info("Starting fresh investigation of {} anomalies over {} facets", anomalies.size(), breakdowns.size());

    Future<Void> chain = Future.succeededFuture();
    for (Anomaly anomaly : anomalies) {
      chain = chain.compose(v -> investigateAnomaly(anomaly, window, query, baseTimeRange, baseFilters, epoch));
    }

    return chain.map(v -> {
      if (!session.isCurrent(epoch)) {
        log.debug("Investigation epoch {} superseded, discarding", epoch);
        return InvestigationOutcome.superseded();
      }
      return saveFresh(cacheKey, query.snapshot());
    });
  }

  private Future<Void> investigateAnomaly(Anomaly anomaly, TimeWindow window, QuerySnapshot query,
                                          String baseTimeRange, String baseFilters, long epoch) {
    if (!session.isCurrent(epoch)) {
      return Future.succeededFuture();
    }
    String anomalyId = AnomalyIdGenerator.generate(
      baseTimeRange, baseFilters, anomaly.startTime(), anomaly.endTime(), anomaly.category());
    InvestigationResult result = new InvestigationResult(anomaly, anomalyId);
    result.markAwaitingFacets();
    session.register(result);

    List<Future<List<Contributor>>> facets = new ArrayList<>(breakdowns.size());
    for (Breakdown breakdown : breakdowns) {
      facets.add(facetAnalyzer.investigate(breakdown, anomaly, window, query)
        .map(found -> {
          onFacetResolved(result, breakdown, found, epoch);
          return found;
        }));
    }

    return Future.all(facets)
      .map(all -> {
        if (session.isCurrent(epoch)) {
          result.markComplete();
          log.info("Investigated {} ({}): {} facets with contributors",
            anomaly.describe(), anomalyId, result.facets().size());
        }
        return null;
      });
  }

  private void onFacetResolved(InvestigationResult result, Breakdown breakdown, List<Contributor> found, long epoch) {
    if (!session.isCurrent(epoch) || found.isEmpty()) {
      return;
    }
    int rank = result.anomaly().rank();
    List<Contributor> tagged = found.stream()
      .map(c -> c.tagged(result.anomalyId(), rank))
      .collect(Collectors.toList());
    result.putFacet(breakdown.id(), tagged);
    session.addContributors(tagged);
    session.highlights(HighlightSelector.select(
      session.sortedContributors(), renderable, context.focusedAnomalyId(), budget));
  }

  private InvestigationOutcome saveFresh(String cacheKey, QueryContext savedContext) {
    List<Contributor> sorted = session.sortedContributors();
    List<Contributor> top = sorted.size() > cacheTopN ? sorted.subList(0, cacheTopN) : sorted;
    List<InvestigationResult> results = session.results();

    session.cachedTopContributors(top);
    cache.remember(new MemoryEntry(cacheKey, results, savedContext, top));
    cache.saveDurable(cacheKey, results, top, savedContext);

    if (sorted.isEmpty()) {
      session.clearHighlights();
    }
    log.info("Fresh investigation found {} contributors across {} anomalies", sorted.size(), results.size());
    return new InvestigationOutcome(results, Source.FRESH);
  }

  private InvestigationOutcome record(InvestigationOutcome outcome, long startedNanos) {
    if (outcome.source() != Source.NONE && outcome.source() != Source.SUPERSEDED) {
      metrics.recordInvestigation(outcome.source().getValue());
      metrics.recordDuration(System.nanoTime() - startedNanos);
    }
    return outcome;
  }

  /**
   * Investigates a user-chosen time range over all facets. Never cached.
   *
   * @param selection the chosen range
   * @param window the full visible range
   * @return Future with contributors of all facets, strongest change first
   */
  public Future<List<SelectionContributor>> investigateSelection(TimeWindow selection, TimeWindow window) {
    session.clearHighlights();
    session.clearSelection();

    List<Future<List<SelectionContributor>>> facets = breakdowns.stream()
      .map(b -> selectionAnalyzer.investigate(b, selection, window))
      .collect(Collectors.toList());

    return Future.all(facets).map(all -> {
      List<SelectionContributor> merged = new ArrayList<>();
      for (Future<List<SelectionContributor>> facet : facets) {
        merged.addAll(facet.result());
      }
      merged.sort(SelectionContributor.BY_MAX_CHANGE);

      session.selectionHighlights(HighlightSelector.selectSelection(merged, renderable, budget));
      log.info("Selection investigation found {} contributors, highlighted {}/{}",
        merged.size(), session.selectionHighlights().size(), budget);
      return merged;
    });
  }

  /**
   * Dimension values of a facet found by the current results, restricted to the focused anomaly.
   */
  public Set<String> getHighlightedDimensions(String facetId) {
    String focused = context.focusedAnomalyId();
    Set<String> dims = new LinkedHashSet<>();
    for (InvestigationResult result : session.results()) {
      if (focused != null && !focused.equals(result.anomalyId())) {
        continue;
      }
      result.facet(facetId).forEach(c -> dims.add(c.dim()));
    }
    return dims;
  }

  public List<HighlightKey> currentHighlights() {
    return List.copyOf(session.highlights());
  }

  public List<HighlightKey> currentSelectionHighlights() {
    return List.copyOf(session.selectionHighlights());
  }

  public List<InvestigationResult> lastResults() {
    return session.results();
  }

  public Optional<InvestigationResult> getResultByAnomalyId(String anomalyId) {
    return session.resultByAnomalyId(anomalyId);
  }

  public Optional<String> getAnomalyIdByRank(int rank) {
    return session.anomalyIdByRank(rank);
  }

  /**
   * Recomputes highlights from the cached top contributors, e.g. after rows were rendered.
   * Does nothing when no top contributors are cached.
   *
   * @return the current highlights
   */
  public List<HighlightKey> reapplyHighlights() {
    List<Contributor> top = session.cachedTopContributors();
    if (!top.isEmpty()) {
      session.highlights(HighlightSelector.select(top, renderable, context.focusedAnomalyId(), budget));
    }
    return currentHighlights();
  }

  /**
   * Drops the memory tier, the current results and highlights, and discards in-flight work.
   */
  public void invalidateCache() {
    cache.clearMemory();
    session.clearResults();
    session.clearHighlights();
    session.nextEpoch();
    log.info("Investigation cache invalidated");
  }

  public boolean hasCachedInvestigation() {
    String cacheKey = AnomalyIdGenerator.cacheKey(context.timeFilter(), context.hostFilter());
    return cache.memoryMatches(cacheKey) || cache.loadDurable(cacheKey, context.snapshot()).isPresent();
  }

  /**
   * Removes every durable entry.
   *
   * @return number of entries removed
   */
  public int clearDurableCache() {
    return cache.clearDurable();
  }
}
