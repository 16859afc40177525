package com.ospicorp.fewsjdbc.gateway;

import java.io.IOException;
import java.util.List;

/**
 * Calls exposed by a Jdbc2Ei server. Implementations throw {@link Jdbc2EiResponseException}
 * when the server answers with something they cannot decode, and any other
 * {@link IOException} when the server cannot be reached.
 *
 * <p>Timestamp columns may be handed out in their wire form (text such as
 * {@code 20080115T13:00:00}), as {@link java.time.LocalDateTime}, as {@link java.time.Instant}
 * or as {@link java.util.Date} decoded in the JVM default time zone.
 */
public interface Jdbc2EiClient {

  void ping() throws IOException;

  String configGet(String tag) throws IOException;

  void configPut(String tag, String value) throws IOException;

  /**
   * Runs {@code statement} against the connections registered under {@code tags}.
   *
   * @return the rows as a {@link List} or array of rows, or an integer error code
   */
  Object execute(String statement, List<String> tags) throws IOException;
}
