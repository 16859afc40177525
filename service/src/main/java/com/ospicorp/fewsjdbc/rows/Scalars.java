package com.ospicorp.fewsjdbc.rows;

/**
 * Coercions for scalar values coming back from the remote side, which may hand out numbers
 * either as numeric types or as their string rendering.
 */
public final class Scalars {
  private Scalars() {
  }

  public static String asString(Object value) {
    return value == null ? null : value.toString();
  }

  /**
   * Renders an identifier. Floating point values without a fractional part render as integers,
   * so {@code -999} and {@code -999.0} name the same id.
   */
  public static String asId(Object value) {
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (d == Math.rint(d) && !Double.isInfinite(d)) {
        return Long.toString((long) d);
      }
    }
    return asString(value);
  }

  public static Double asDouble(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    String text = value.toString().trim();
    if (text.isEmpty()) {
      return null;
    }
    try {
      return Double.valueOf(text);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Not a numeric value: '" + text + "'", ex);
    }
  }
}
