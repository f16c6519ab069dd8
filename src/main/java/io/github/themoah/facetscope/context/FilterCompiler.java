package io.github.themoah.facetscope.context;

import io.github.themoah.facetscope.model.FilterClause;
import io.github.themoah.facetscope.model.FilterGroup;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Compiles structured facet filters into SQL and into the per-column map used for cache eligibility.
 */
public final class FilterCompiler {

  // col = 'val' / col != 'val' / col = 123, col may be backquoted
  private static final Pattern CLAUSE_PATTERN = Pattern.compile(
    "(`[^`]+`|[A-Za-z_][\\w.]*)\\s*(!=|=)\\s*(?:'((?:[^'\\\\]|\\\\.)*)'|(-?\\d+(?:\\.\\d+)?))");

  private FilterCompiler() {}

  /**
   * Compiles filters. Values on the same column are OR-ed when included and AND-ed when excluded.
   *
   * @param filters active filters (null or empty = no filtering)
   * @return compiled SQL and filter map
   */
  public static CompiledFilters compile(List<FilterClause> filters) {
    if (filters == null || filters.isEmpty()) {
      return CompiledFilters.EMPTY;
    }

    Map<String, List<FilterClause>> byColumn = new LinkedHashMap<>();
    for (FilterClause filter : filters) {
      byColumn.computeIfAbsent(filter.column(), k -> new ArrayList<>()).add(filter);
    }

    Map<String, FilterGroup> map = new LinkedHashMap<>();
    List<String> columnClauses = new ArrayList<>();

    for (var entry : byColumn.entrySet()) {
      String column = entry.getKey();
      List<FilterClause> includes = new ArrayList<>();
      List<FilterClause> excludes = new ArrayList<>();
      for (FilterClause clause : entry.getValue()) {
        (clause.isExclude() ? excludes : includes).add(clause);
      }

      map.put(column, new FilterGroup(
        column,
        includes.stream().map(c -> String.valueOf(c.value())).collect(Collectors.toList()),
        excludes.stream().map(c -> String.valueOf(c.value())).collect(Collectors.toList())
      ));

      List<String> parts = new ArrayList<>();
      if (!includes.isEmpty()) {
        List<String> includeParts = includes.stream()
          .map(c -> column + " = " + literal(c.value()))
          .collect(Collectors.toList());
        parts.add(includeParts.size() == 1
          ? includeParts.get(0)
          : "(" + String.join(" OR ", includeParts) + ")");
      }
      if (!excludes.isEmpty()) {
        parts.add(excludes.stream()
          .map(c -> column + " != " + literal(c.value()))
          .collect(Collectors.joining(" AND ")));
      }

      columnClauses.add(parts.size() == 1 ? parts.get(0) : "(" + String.join(" AND ", parts) + ")");
    }

    String sql = columnClauses.stream()
      .map(clause -> "AND " + clause)
      .collect(Collectors.joining(" "));
    return new CompiledFilters(sql, map);
  }

  /**
   * Extracts filters from a SQL clause string such as {@code AND `request.host` = 'a.com'}.
   * Used for contexts that only carry the rendered SQL.
   *
   * @param clause SQL fragment, may be null
   * @return filters found, in order of appearance
   */
  public static List<FilterClause> parse(String clause) {
    List<FilterClause> filters = new ArrayList<>();
    if (clause == null || clause.isBlank()) {
      return filters;
    }
    Matcher matcher = CLAUSE_PATTERN.matcher(clause);
    while (matcher.find()) {
      String column = matcher.group(1);
      FilterClause.Operator op = FilterClause.Operator.fromSymbol(matcher.group(2));
      Object value = matcher.group(3) != null
        ? matcher.group(3).replace("\\'", "'")
        : parseNumber(matcher.group(4));
      filters.add(new FilterClause(column, op, value));
    }
    return filters;
  }

  static String literal(Object value) {
    if (value instanceof Number) {
      return String.valueOf(value);
    }
    return "'" + escape(String.valueOf(value)) + "'";
  }

  static String escape(String value) {
    return value.replace("'", "\\'");
  }

  private static Number parseNumber(String text) {
    if (text.contains(".")) {
      return Double.parseDouble(text);
    }
    return Long.parseLong(text);
  }
}
