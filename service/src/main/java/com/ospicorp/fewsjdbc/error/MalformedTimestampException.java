package com.ospicorp.fewsjdbc.error;

public final class MalformedTimestampException extends FewsJdbcException {

  private final String raw;

  public MalformedTimestampException(String raw, Throwable cause) {
    super(ErrorKind.MALFORMED_TIMESTAMP, "Cannot parse remote timestamp '" + raw + "'", cause);
    this.raw = raw;
  }

  public String raw() {
    return raw;
  }
}
