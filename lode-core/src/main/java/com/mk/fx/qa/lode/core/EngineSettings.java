package com.mk.fx.qa.lode.core;

import java.time.Duration;

/**
 * Settings of a {@link LoadTestEngine} that outlive a single run.
 *
 * @param workerThreads size of the pool driving HTTP I/O completions and slot continuations
 * @param connectTimeout upper bound for establishing a connection; each request's own timeout still
 *     applies when it is shorter
 */
public record EngineSettings(int workerThreads, Duration connectTimeout) {

  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

  public EngineSettings {
    if (workerThreads < 1) {
      throw new IllegalArgumentException("workerThreads must be >= 1");
    }
    connectTimeout = connectTimeout != null ? connectTimeout : DEFAULT_CONNECT_TIMEOUT;
  }

  public static EngineSettings defaults() {
    return new EngineSettings(
        Math.max(2, Runtime.getRuntime().availableProcessors()), DEFAULT_CONNECT_TIMEOUT);
  }
}
