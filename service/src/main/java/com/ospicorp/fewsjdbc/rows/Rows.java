package com.ospicorp.fewsjdbc.rows;

import com.ospicorp.fewsjdbc.error.SchemaMismatchException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Helpers for the tabular results returned by the remote query endpoint. A row is an ordered
 * list of scalar values; scalars may be {@code null}.
 */
public final class Rows {
  private Rows() {
  }

  /**
   * Drops rows equal to an earlier row. Distinct rows keep their first-occurrence order.
   */
  public static List<List<Object>> dedup(List<? extends List<?>> rows) {
    Set<List<Object>> seen = new LinkedHashSet<>();
    for (List<?> row : rows) {
      seen.add(Collections.unmodifiableList(new ArrayList<>(row)));
    }
    return new ArrayList<>(seen);
  }

  /**
   * Zips every row positionally with {@code columns}.
   *
   * @throws SchemaMismatchException if a row does not have exactly one value per column
   */
  public static List<Map<String, Object>> named(List<? extends List<?>> rows,
      List<String> columns) {
    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      List<?> row = rows.get(i);
      if (row == null || row.size() != columns.size()) {
        throw new SchemaMismatchException(columns, i, row == null ? 0 : row.size());
      }
      Map<String, Object> mapped = new LinkedHashMap<>();
      for (int c = 0; c < columns.size(); c++) {
        mapped.put(columns.get(c), row.get(c));
      }
      out.add(mapped);
    }
    return out;
  }
}
