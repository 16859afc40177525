package com.ospicorp.fewsjdbc.gateway;

import java.io.IOException;

/**
 * The server was reached but its answer could not be decoded.
 */
public class Jdbc2EiResponseException extends IOException {

  public Jdbc2EiResponseException(String message) {
    super(message);
  }

  public Jdbc2EiResponseException(String message, Throwable cause) {
    super(message, cause);
  }
}
