package com.ospicorp.fewsjdbc.resolver;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Statements understood by the Jdbc2Ei FEWS tables. Literals are single quoted with embedded
 * quotes doubled.
 */
final class QueryStatements {
  static final DateTimeFormatter JDBC_DATE_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  static final String FILTERS = "select id, name, parentid from filters";

  private QueryStatements() {
  }

  static String parameters(String filterId) {
    return "select name, parameterid, parameter from filters where id=" + literal(filterId);
  }

  static String parameterName(String parameterId) {
    return "select name from parameters where id=" + literal(parameterId);
  }

  static String locations(String filterId, String parameterId) {
    return "select longitude, latitude, location, locationid from filters where id="
        + literal(filterId) + " and parameterid=" + literal(parameterId);
  }

  static String timeSeries(String filterId, String locationId, String parameterId,
      LocalDateTime start, LocalDateTime end) {
    return "select time, value, flag, detection, comment from extimeseries where filterid="
        + literal(filterId) + " and locationid=" + literal(locationId)
        + " and parameterid=" + literal(parameterId)
        + " and time between " + literal(JDBC_DATE_FORMAT.format(start))
        + " and " + literal(JDBC_DATE_FORMAT.format(end));
  }

  static String unit(String parameterId) {
    return "select unit from parameters where id=" + literal(parameterId);
  }

  static String literal(String value) {
    if (value == null) {
      throw new IllegalArgumentException("query arguments must not be null");
    }
    return "'" + value.replace("'", "''") + "'";
  }
}
