package com.ospicorp.fewsjdbc.error;

import java.util.List;

public final class SchemaMismatchException extends FewsJdbcException {

  private final List<String> columns;
  private final int rowIndex;
  private final int actualArity;

  public SchemaMismatchException(List<String> columns, int rowIndex, int actualArity) {
    super(ErrorKind.SCHEMA_MISMATCH, "Row " + rowIndex + " has " + actualArity
        + " values but " + columns.size() + " columns are expected: " + columns);
    this.columns = List.copyOf(columns);
    this.rowIndex = rowIndex;
    this.actualArity = actualArity;
  }

  public List<String> columns() {
    return columns;
  }

  public int rowIndex() {
    return rowIndex;
  }

  public int actualArity() {
    return actualArity;
  }
}
