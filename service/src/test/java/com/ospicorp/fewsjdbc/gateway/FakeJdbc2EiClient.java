package com.ospicorp.fewsjdbc.gateway;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable in-memory Jdbc2Ei server. Statements without a scripted answer return no rows.
 */
public class FakeJdbc2EiClient implements Jdbc2EiClient {

  public final AtomicInteger pings = new AtomicInteger();
  public final AtomicInteger configGets = new AtomicInteger();
  public final AtomicInteger configPuts = new AtomicInteger();
  public final AtomicInteger executions = new AtomicInteger();
  public final List<String> statements = new ArrayList<>();
  public final Map<String, String> config = new HashMap<>();

  private final Map<String, Object> answers = new HashMap<>();
  private IOException pingFailure;
  private IOException configGetFailure;
  private long executeDelayMillis;
  private boolean ignoreInterrupts;

  public FakeJdbc2EiClient answer(String statement, Object result) {
    answers.put(statement, result);
    return this;
  }

  public FakeJdbc2EiClient failPing(IOException failure) {
    this.pingFailure = failure;
    return this;
  }

  public FakeJdbc2EiClient failConfigGet(IOException failure) {
    this.configGetFailure = failure;
    return this;
  }

  public FakeJdbc2EiClient delayExecute(long millis) {
    this.executeDelayMillis = millis;
    return this;
  }

  /**
   * Makes the execute delay behave like a blocking socket read, which cancellation cannot end.
   */
  public FakeJdbc2EiClient hangExecute(long millis) {
    this.executeDelayMillis = millis;
    this.ignoreInterrupts = true;
    return this;
  }

  @Override
  public void ping() throws IOException {
    pings.incrementAndGet();
    if (pingFailure != null) {
      throw pingFailure;
    }
  }

  @Override
  public synchronized String configGet(String tag) throws IOException {
    configGets.incrementAndGet();
    if (configGetFailure != null) {
      throw configGetFailure;
    }
    String value = config.get(tag);
    if (value == null) {
      throw new Jdbc2EiResponseException("no configuration for " + tag);
    }
    return value;
  }

  @Override
  public synchronized void configPut(String tag, String value) {
    configPuts.incrementAndGet();
    config.put(tag, value);
  }

  @Override
  public Object execute(String statement, List<String> tags) throws IOException {
    executions.incrementAndGet();
    synchronized (this) {
      statements.add(statement);
    }
    if (executeDelayMillis > 0) {
      sleep(executeDelayMillis);
    }
    return answers.getOrDefault(statement, List.of());
  }

  private void sleep(long millis) throws IOException {
    long deadline = System.nanoTime() + millis * 1_000_000L;
    boolean interrupted = false;
    while (System.nanoTime() < deadline) {
      try {
        Thread.sleep(Math.max(1, (deadline - System.nanoTime()) / 1_000_000L));
      } catch (InterruptedException ex) {
        if (!ignoreInterrupts) {
          Thread.currentThread().interrupt();
          throw new IOException("interrupted", ex);
        }
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }
}
