package io.github.themoah.facetscope.context;

import io.github.themoah.facetscope.model.FilterClause;
import io.github.themoah.facetscope.model.FilterGroup;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Snapshot of the time, host and filter state an investigation was run against.
 *
 * @param timeFilter resolved time predicate (compared verbatim)
 * @param hostFilter resolved host predicate (compared verbatim, empty when none)
 * @param filterMap active filters per column
 */
public record QueryContext(String timeFilter, String hostFilter, Map<String, FilterGroup> filterMap) {

  private static final Logger log = LoggerFactory.getLogger(QueryContext.class);

  public QueryContext {
    timeFilter = timeFilter == null ? "" : timeFilter;
    hostFilter = hostFilter == null ? "" : hostFilter;
    filterMap = filterMap == null ? Map.of() : Map.copyOf(filterMap);
  }

  /**
   * Decides whether results cached under {@code cached} may be reused for {@code current}.
   * Time and host must match exactly; current filters must contain every cached filter.
   * Adding filters (drill-in) keeps the cache usable, removing or changing one (drill-out) does not.
   *
   * @param current the context being displayed now
   * @param cached the context the cached results were computed for
   * @return true if the cache is eligible
   */
  public static boolean isEligible(QueryContext current, QueryContext cached) {
    Objects.requireNonNull(current, "current cannot be null");
    Objects.requireNonNull(cached, "cached cannot be null");

    if (!current.timeFilter.equals(cached.timeFilter)) {
      log.debug("Cache ineligible: time filter changed");
      return false;
    }
    if (!current.hostFilter.equals(cached.hostFilter)) {
      log.debug("Cache ineligible: host filter changed");
      return false;
    }
    if (!current.isSupersetOf(cached)) {
      log.debug("Cache ineligible: filters changed or removed");
      return false;
    }

    int cachedCount = cached.filterMap.size();
    int currentCount = current.filterMap.size();
    if (currentCount > cachedCount) {
      log.debug("Cache eligible: drilled in ({} -> {} filters)", cachedCount, currentCount);
    } else {
      log.debug("Cache eligible: same context");
    }
    return true;
  }

  /**
   * True if every filter column and value of {@code other} is also active here.
   */
  public boolean isSupersetOf(QueryContext other) {
    for (var entry : other.filterMap.entrySet()) {
      FilterGroup mine = filterMap.get(entry.getKey());
      if (mine == null || !mine.covers(entry.getValue())) {
        return false;
      }
    }
    return true;
  }

  public JsonObject toJson() {
    JsonObject filters = new JsonObject();
    filterMap.forEach((column, group) -> filters.put(column, new JsonObject()
      .put("includes", new JsonArray(new ArrayList<>(group.includes())))
      .put("excludes", new JsonArray(new ArrayList<>(group.excludes())))));
    return new JsonObject()
      .put("timeFilter", timeFilter)
      .put("hostFilter", hostFilter)
      .put("filterMap", filters);
  }

  /**
   * Parses a stored context. Contexts that only carry the rendered {@code facetFilters}
   * SQL get their filter map rebuilt from it.
   */
  public static QueryContext fromJson(JsonObject json) {
    if (!json.containsKey("filterMap") && json.containsKey("facetFilters")) {
      List<FilterClause> parsed = FilterCompiler.parse(json.getString("facetFilters"));
      return new QueryContext(json.getString("timeFilter"), json.getString("hostFilter"),
        FilterCompiler.compile(parsed).map());
    }
    Map<String, FilterGroup> map = new LinkedHashMap<>();
    JsonObject filters = json.getJsonObject("filterMap", new JsonObject());
    for (String column : filters.fieldNames()) {
      JsonObject group = filters.getJsonObject(column);
      map.put(column, new FilterGroup(
        column,
        stringList(group.getJsonArray("includes")),
        stringList(group.getJsonArray("excludes"))
      ));
    }
    return new QueryContext(json.getString("timeFilter"), json.getString("hostFilter"), map);
  }

  private static List<String> stringList(JsonArray array) {
    List<String> values = new ArrayList<>();
    if (array != null) {
      array.forEach(v -> values.add(String.valueOf(v)));
    }
    return values;
  }
}
