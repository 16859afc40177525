package com.ospicorp.fewsjdbc.gateway;

import com.ospicorp.fewsjdbc.error.RemoteQueryException;
import com.ospicorp.fewsjdbc.error.RemoteUnavailableException;
import com.ospicorp.fewsjdbc.source.JdbcSource;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Runs statements on the Jdbc2Ei server behind a {@link JdbcSource}: probes the server,
 * registers the source's tag when the server does not know it and turns integer answers into
 * {@link RemoteQueryException}s.
 *
 * <p>Every remote call is bounded by the configured timeout. Calls run on a small pool owned by
 * their endpoint, so threads stuck on one unresponsive server never delay another.
 */
public class RemoteQueryGateway implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RemoteQueryGateway.class);

  private final Jdbc2EiClientFactory clientFactory;
  private final Duration timeout;
  private final int threadsPerEndpoint;
  private final Map<String, Jdbc2EiClient> clients = new ConcurrentHashMap<>();
  private final Map<String, ExecutorService> executors = new ConcurrentHashMap<>();

  public RemoteQueryGateway(Jdbc2EiClientFactory clientFactory, Duration timeout,
      int threadsPerEndpoint) {
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    if (threadsPerEndpoint < 1) {
      throw new IllegalArgumentException("threadsPerEndpoint must be at least 1");
    }
    this.clientFactory = clientFactory;
    this.timeout = timeout;
    this.threadsPerEndpoint = threadsPerEndpoint;
  }

  /**
   * @throws RemoteUnavailableException if the server cannot be reached in time
   * @throws RemoteQueryException if the server answers with an error code
   */
  public List<List<Object>> query(JdbcSource source, String statement) {
    if (statement.indexOf('"') >= 0) {
      log.warn("You used double quotes in the query. Is it intended? Query: {}", statement);
    }
    String endpoint = source.jdbcUrl();
    Jdbc2EiClient client =
        clients.computeIfAbsent(endpoint, url -> clientFactory.forEndpoint(url, timeout));

    call(endpoint, () -> {
      client.ping();
      return null;
    });
    ensureRegistered(endpoint, client, source);

    log.debug("Executing on {}: {}", source.slug(), statement);
    Object result = call(endpoint, () -> client.execute(statement, List.of(source.tagName())));
    return classify(endpoint, statement, result);
  }

  @Override
  public void close() {
    executors.values().forEach(ExecutorService::shutdownNow);
    executors.clear();
  }

  // The server may lose its configuration on restart, so the tag is checked on every query.
  // The put writes the same value each time, which makes racing callers harmless.
  private void ensureRegistered(String endpoint, Jdbc2EiClient client, JdbcSource source) {
    call(endpoint, () -> {
      try {
        client.configGet(source.tagName());
      } catch (Jdbc2EiResponseException ex) {
        log.info("Registering tag {} on {}", source.tagName(), endpoint);
        client.configPut(source.tagName(), source.connectorString());
      }
      return null;
    });
  }

  private List<List<Object>> classify(String endpoint, String statement, Object result) {
    if (result instanceof Number code) {
      throw new RemoteQueryException(code.intValue(), statement);
    }
    List<?> rows = asList(result);
    if (rows == null) {
      throw new RemoteUnavailableException(endpoint, new Jdbc2EiResponseException(
          "Unexpected result type " + typeName(result) + " for query [" + statement + "]"));
    }
    List<List<Object>> out = new ArrayList<>(rows.size());
    for (Object row : rows) {
      List<?> values = asList(row);
      if (values == null) {
        throw new RemoteUnavailableException(endpoint, new Jdbc2EiResponseException(
            "Unexpected row type " + typeName(row) + " for query [" + statement + "]"));
      }
      out.add(new ArrayList<>(values));
    }
    return out;
  }

  private <T> T call(String endpoint, Callable<T> remoteCall) {
    Future<T> future = executorFor(endpoint).submit(remoteCall);
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      throw new RemoteUnavailableException(endpoint, ex);
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new RemoteUnavailableException(endpoint, ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof IOException) {
        throw new RemoteUnavailableException(endpoint, cause);
      }
      throw new IllegalStateException("Remote call to " + endpoint + " failed", cause);
    }
  }

  private ExecutorService executorFor(String endpoint) {
    return executors.computeIfAbsent(endpoint, url -> {
      CustomizableThreadFactory threads = new CustomizableThreadFactory("fewsjdbc-remote-");
      threads.setDaemon(true);
      return Executors.newFixedThreadPool(threadsPerEndpoint, threads);
    });
  }

  private static List<?> asList(Object value) {
    if (value instanceof List<?> list) {
      return list;
    }
    if (value instanceof Object[] array) {
      return Arrays.asList(array);
    }
    return null;
  }

  private static String typeName(Object value) {
    return value == null ? "null" : value.getClass().getName();
  }
}
