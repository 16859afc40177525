package com.ospicorp.fewsjdbc.error;

/**
 * The remote side answered a statement with an integer error code instead of a result set.
 */
public final class RemoteQueryException extends FewsJdbcException {

  private final int code;
  private final String statement;

  public RemoteQueryException(int code, String statement) {
    super(ErrorKind.REMOTE_QUERY_ERROR,
        "The FEWS jdbc query [" + statement + "] returned error code " + code);
    this.code = code;
    this.statement = statement;
  }

  public int code() {
    return code;
  }

  public String statement() {
    return statement;
  }
}
