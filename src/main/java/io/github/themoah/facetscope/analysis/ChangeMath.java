package io.github.themoah.facetscope.analysis;

/**
 * Arithmetic shared by the anomaly and selection analyses.
 */
final class ChangeMath {

  private ChangeMath() {}

  /**
   * Rounds to one decimal, halves toward positive infinity. Infinite values pass through.
   */
  static double round1(double value) {
    if (Double.isInfinite(value) || Double.isNaN(value)) {
      return value;
    }
    return Math.round(value * 10) / 10.0;
  }

  static double perMinute(long count, double minutes) {
    return minutes > 0 ? count / minutes : 0;
  }

  /**
   * Percent change from {@code base} to {@code current}; +Infinity when only current is non-zero.
   */
  static double percentChange(double current, double base) {
    if (base > 0) {
      return (current - base) / base * 100;
    }
    return current > 0 ? Double.POSITIVE_INFINITY : 0;
  }

  static double percentOf(long part, long total) {
    return total > 0 ? (double) part / total * 100 : 0;
  }
}
