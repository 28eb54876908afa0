package com.mk.fx.qa.lode.core;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.google.common.base.Preconditions;
import com.mk.fx.qa.lode.core.config.LoadTestConfig;
import com.mk.fx.qa.lode.core.dispatch.LoadDispatcher;
import com.mk.fx.qa.lode.core.dispatch.RunState;
import com.mk.fx.qa.lode.core.http.HttpRequestExecutor;
import com.mk.fx.qa.lode.core.http.RequestExecutor;
import com.mk.fx.qa.lode.core.metrics.ProgressListener;
import com.mk.fx.qa.lode.core.metrics.ResultAggregator;
import com.mk.fx.qa.lode.core.report.LoadReportBuilder;
import com.mk.fx.qa.lode.core.report.LoadTestReport;
import java.net.http.HttpClient;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the load generator: runs a {@link LoadTestConfig} to completion and returns its
 * {@link LoadTestReport}.
 *
 * <p>One engine owns a small worker pool and a shared HTTP client and may execute any number of
 * runs, sequentially or concurrently; every run gets its own countdown and aggregator. Close the
 * engine to release the pool.
 */
@Slf4j
public class LoadTestEngine implements AutoCloseable {

  private static final AtomicInteger ENGINE_SEQUENCE = new AtomicInteger();

  private final ExecutorService workers;
  private final HttpClient httpClient;
  private final LoadDispatcher dispatcher;
  private final LoadReportBuilder reportBuilder = new LoadReportBuilder();

  public LoadTestEngine() {
    this(EngineSettings.defaults());
  }

  public LoadTestEngine(EngineSettings settings) {
    Objects.requireNonNull(settings, "settings");
    int engineId = ENGINE_SEQUENCE.incrementAndGet();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("lode-worker-" + engineId + "-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };
    this.workers = newFixedThreadPool(settings.workerThreads(), threadFactory);
    this.httpClient =
        HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(settings.connectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .executor(workers)
            .build();
    this.dispatcher = new LoadDispatcher(workers);
    log.info(
        "LoadTestEngine initialised with workerThreads={} connectTimeout={}",
        settings.workerThreads(),
        settings.connectTimeout());
  }

  public LoadTestReport run(LoadTestConfig config) {
    return run(config, ProgressListener.NONE);
  }

  /**
   * Runs a load test against the configured HTTP target.
   *
   * @param config validated run configuration
   * @param progressListener notified after every completed attempt
   * @return the completed report
   * @throws com.mk.fx.qa.lode.core.config.InvalidConfigException if no request can be built
   * @throws LoadTestAbortedException if the calling thread is interrupted during the run
   */
  public LoadTestReport run(LoadTestConfig config, ProgressListener progressListener) {
    Objects.requireNonNull(config, "config");
    var runId = UUID.randomUUID().toString();
    var executor = new HttpRequestExecutor(httpClient, config, runId);
    return run(runId, config, executor, progressListener);
  }

  /**
   * Runs a load test with a caller-supplied executor in place of the HTTP client. The config still
   * provides the request count and concurrency ceiling.
   */
  public LoadTestReport run(
      LoadTestConfig config, RequestExecutor executor, ProgressListener progressListener) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(executor, "executor");
    return run(UUID.randomUUID().toString(), config, executor, progressListener);
  }

  private LoadTestReport run(
      String runId,
      LoadTestConfig config,
      RequestExecutor executor,
      ProgressListener progressListener) {
    log.info(
        "Run {} starting: {} {} requests={} concurrency={} timeout={}",
        runId,
        config.method(),
        config.url(),
        config.requests(),
        config.concurrency(),
        config.timeout());

    var aggregator = new ResultAggregator(runId, config.requests(), progressListener);
    var state = new RunState(runId, config.requests(), aggregator);
    try {
      dispatcher.dispatch(state, config.effectiveConcurrency(), executor);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new LoadTestAbortedException(runId, "Run " + runId + " was interrupted", interrupted);
    }

    var snapshot = aggregator.freeze();
    Preconditions.checkState(
        snapshot.total() == config.requests(),
        "Run %s completed %s of %s requests",
        runId,
        snapshot.total(),
        config.requests());
    return reportBuilder.build(runId, snapshot, state.elapsed());
  }

  @Override
  public void close() {
    workers.shutdownNow();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("LoadTestEngine workers did not terminate within 5s");
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
    }
  }
}
