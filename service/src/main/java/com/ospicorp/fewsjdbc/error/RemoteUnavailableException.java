package com.ospicorp.fewsjdbc.error;

/**
 * The remote endpoint could not be reached: DNS failure, refused connection or a timed out
 * probe or query.
 */
public final class RemoteUnavailableException extends FewsJdbcException {

  private final String endpoint;

  public RemoteUnavailableException(String endpoint, Throwable cause) {
    super(ErrorKind.REMOTE_UNAVAILABLE,
        "Jdbc2Ei server not available at " + endpoint + ": " + describe(cause), cause);
    this.endpoint = endpoint;
  }

  public String endpoint() {
    return endpoint;
  }

  private static String describe(Throwable cause) {
    if (cause == null) {
      return "unknown cause";
    }
    String message = cause.getMessage();
    return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
  }
}
