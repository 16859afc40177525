package com.ospicorp.fewsjdbc.gateway;

import java.time.Duration;

@FunctionalInterface
public interface Jdbc2EiClientFactory {

  /**
   * @param timeout connect and reply timeout the transport should apply to its own sockets
   */
  Jdbc2EiClient forEndpoint(String jdbcUrl, Duration timeout);
}
