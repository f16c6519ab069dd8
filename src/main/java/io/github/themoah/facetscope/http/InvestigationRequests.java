package io.github.themoah.facetscope.http;

import io.github.themoah.facetscope.context.QueryState;
import io.github.themoah.facetscope.context.TimeRange;
import io.github.themoah.facetscope.model.Anomaly;
import io.github.themoah.facetscope.model.ChartPoint;
import io.github.themoah.facetscope.model.FilterClause;
import io.github.themoah.facetscope.model.TimeWindow;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Parses investigation request bodies. Invalid input raises {@link IllegalArgumentException}.
 */
final class InvestigationRequests {

  private InvestigationRequests() {}

  static List<Anomaly> anomalies(JsonObject body) {
    JsonArray array = requireArray(body, "anomalies");
    List<Anomaly> anomalies = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      try {
        anomalies.add(Anomaly.fromJson(array.getJsonObject(i)));
      } catch (ClassCastException | NullPointerException | DateTimeParseException e) {
        throw new IllegalArgumentException("Invalid anomaly at index " + i + ": " + e.getMessage(), e);
      }
    }
    return anomalies;
  }

  static List<ChartPoint> chartData(JsonObject body) {
    JsonArray array = body.getJsonArray("chartData", new JsonArray());
    List<ChartPoint> points = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      JsonObject point = array.getJsonObject(i);
      if (point == null) {
        throw new IllegalArgumentException("Missing chart point at index " + i);
      }
      points.add(new ChartPoint(
        instant(point.getValue("t"), "chartData[" + i + "].t"),
        point.getLong("cnt_ok", 0L),
        point.getLong("cnt_4xx", 0L),
        point.getLong("cnt_5xx", 0L)));
    }
    return points;
  }

  /**
   * Parses the request's query context. The returned update sets every field of the shared
   * state; absent fields reset to defaults: last hour, no host, no filters, no focus.
   * Nothing is applied until the whole context has parsed.
   */
  static Consumer<QueryState> context(JsonObject body) {
    JsonObject context = body.getJsonObject("context", new JsonObject());
    String host = context.getString("host", "");
    List<FilterClause> filters = filters(context.getJsonArray("filters", new JsonArray()));
    String focus = context.getString("anomaly");

    Consumer<QueryState> range;
    if (context.containsKey("start") && context.containsKey("end")) {
      TimeWindow window = new TimeWindow(
        instant(context.getValue("start"), "context.start"),
        instant(context.getValue("end"), "context.end"));
      range = state -> state.customRange(window);
    } else {
      TimeRange timeRange = TimeRange.fromValue(context.getString("timeRange", TimeRange.LAST_HOUR.getValue()));
      Instant queryTimestamp = context.containsKey("queryTimestamp")
        ? instant(context.getValue("queryTimestamp"), "context.queryTimestamp")
        : Instant.now();
      range = state -> state.relativeRange(timeRange, queryTimestamp);
    }

    return range.andThen(state -> state.host(host).filters(filters).focus(focus));
  }

  static List<FilterClause> filters(JsonArray array) {
    List<FilterClause> filters = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      JsonObject filter = array.getJsonObject(i);
      if (filter == null) {
        throw new IllegalArgumentException("Missing filter at index " + i);
      }
      String column = filter.getString("column");
      Object value = filter.getValue("value");
      if (column == null || column.isBlank() || value == null) {
        throw new IllegalArgumentException("Filter at index " + i + " needs a column and a value");
      }
      filters.add(new FilterClause(
        column,
        FilterClause.Operator.fromSymbol(filter.getString("operator", "=")),
        value));
    }
    return filters;
  }

  static TimeWindow window(JsonObject body, String startField, String endField) {
    Instant start = instant(body.getValue(startField), startField);
    Instant end = instant(body.getValue(endField), endField);
    if (end.isBefore(start)) {
      throw new IllegalArgumentException(endField + " is before " + startField);
    }
    return new TimeWindow(start, end);
  }

  /**
   * Parses a {@code {facetId: [dims...]}} object.
   */
  static Map<String, List<String>> renderedRows(JsonObject body) {
    Map<String, List<String>> rows = new LinkedHashMap<>();
    for (String facetId : body.fieldNames()) {
      Object value = body.getValue(facetId);
      if (!(value instanceof JsonArray dims)) {
        throw new IllegalArgumentException("Rows of " + facetId + " must be an array");
      }
      List<String> list = new ArrayList<>(dims.size());
      dims.forEach(d -> list.add(String.valueOf(d)));
      rows.put(facetId, list);
    }
    return rows;
  }

  private static JsonArray requireArray(JsonObject body, String field) {
    Object value = body.getValue(field);
    if (!(value instanceof JsonArray array)) {
      throw new IllegalArgumentException("Field '" + field + "' must be an array");
    }
    return array;
  }

  private static Instant instant(Object value, String field) {
    try {
      return Anomaly.parseInstant(value);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid timestamp in " + field + ": " + value, e);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Missing or invalid timestamp in " + field, e);
    }
  }
}
