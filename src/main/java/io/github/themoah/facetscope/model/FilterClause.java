package io.github.themoah.facetscope.model;

import java.util.Objects;

/**
 * One active facet filter.
 *
 * @param column SQL column the filter applies to
 * @param operator include or exclude
 * @param value filter value (String or Number)
 */
public record FilterClause(String column, Operator operator, Object value) {

  public FilterClause {
    Objects.requireNonNull(column, "column cannot be null");
    Objects.requireNonNull(operator, "operator cannot be null");
    Objects.requireNonNull(value, "value cannot be null");
  }

  public static FilterClause equalTo(String column, Object value) {
    return new FilterClause(column, Operator.EQUALS, value);
  }

  public static FilterClause notEqualTo(String column, Object value) {
    return new FilterClause(column, Operator.NOT_EQUALS, value);
  }

  public boolean isExclude() {
    return operator == Operator.NOT_EQUALS;
  }

  /**
   * Filter comparison operator.
   */
  public enum Operator {
    EQUALS("="),
    NOT_EQUALS("!=");

    private final String symbol;

    Operator(String symbol) {
      this.symbol = symbol;
    }

    public String getSymbol() {
      return symbol;
    }

    public static Operator fromSymbol(String symbol) {
      for (Operator op : values()) {
        if (op.symbol.equals(symbol) || op.name().equalsIgnoreCase(symbol)) {
          return op;
        }
      }
      throw new IllegalArgumentException("Unknown filter operator: " + symbol);
    }
  }
}
