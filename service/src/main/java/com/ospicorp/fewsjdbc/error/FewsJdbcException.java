package com.ospicorp.fewsjdbc.error;

/**
 * Root of every failure surfaced by the gateway and the resolver. Callers switch on
 * {@link #kind()} rather than on the concrete class.
 */
public abstract sealed class FewsJdbcException extends RuntimeException
    permits RemoteUnavailableException, RemoteQueryException, SchemaMismatchException,
    NotFoundException, MalformedTimestampException {

  private final ErrorKind kind;

  protected FewsJdbcException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected FewsJdbcException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }
}
