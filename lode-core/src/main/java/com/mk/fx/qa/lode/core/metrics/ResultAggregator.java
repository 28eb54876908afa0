package com.mk.fx.qa.lode.core.metrics;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.lode.core.outcome.Outcome;
import com.mk.fx.qa.lode.core.outcome.OutcomeClassifier;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Folds completed outcomes into success/failure counts, the success latency histogram and the
 * error-label tally.
 *
 * <p>Thread-safety: every update runs under this object's monitor, so concurrent folds can neither
 * lose a count nor tear the histogram. The fold is commutative; the final state does not depend on
 * completion order. After {@link #freeze()} no further folds are accepted.
 */
@Slf4j
public class ResultAggregator {

  static final int PROGRESS_LOG_INTERVAL = 100;

  private final String runId;
  private final long expectedTotal;
  private final ProgressListener progressListener;

  private final LatencyHistogram latencies = new LatencyHistogram();
  private final Map<String, Long> errorCounts = new LinkedHashMap<>();
  private long successful;
  private long failed;
  private long latencySumNanos;
  private boolean frozen;
  private long lastProgressLogNanos = System.nanoTime();

  public ResultAggregator(String runId, long expectedTotal, ProgressListener progressListener) {
    this.runId = Objects.requireNonNull(runId, "runId");
    this.expectedTotal = expectedTotal;
    this.progressListener = progressListener != null ? progressListener : ProgressListener.NONE;
  }

  @VisibleForTesting
  ResultAggregator(String runId, long expectedTotal) {
    this(runId, expectedTotal, ProgressListener.NONE);
  }

  /**
   * Folds one outcome into the running state.
   *
   * @throws IllegalStateException if the aggregator has already been frozen
   */
  public void fold(Outcome outcome) {
    Objects.requireNonNull(outcome, "outcome");
    long completed;
    synchronized (this) {
      if (frozen) {
        throw new IllegalStateException("Run " + runId + " is already frozen");
      }
      if (outcome.isSuccess()) {
        successful++;
        latencySumNanos += outcome.duration().toNanos();
        latencies.record(outcome.duration());
      } else {
        failed++;
        errorCounts.merge(OutcomeClassifier.label(outcome), 1L, Long::sum);
      }
      completed = successful + failed;
      if (completed % PROGRESS_LOG_INTERVAL == 0) {
        logProgress(completed);
      }
    }
    progressListener.onProgress(completed, expectedTotal);
  }

  public synchronized long completed() {
    return successful + failed;
  }

  /** Stops accepting folds and returns the final state. Idempotent. */
  public synchronized AggregateSnapshot freeze() {
    frozen = true;
    return new AggregateSnapshot(
        successful, failed, latencies.copy(), latencySumNanos, errorCounts);
  }

  public synchronized boolean isFrozen() {
    return frozen;
  }

  private void logProgress(long completed) {
    long now = System.nanoTime();
    double elapsedSec = Math.max(1e-9, (now - lastProgressLogNanos) / 1_000_000_000.0);
    lastProgressLogNanos = now;
    log.info(
        "Run {} progress: {}/{} requests, current rps={}, success rate={}% ({} failed)",
        runId,
        completed,
        expectedTotal,
        String.format("%.2f", PROGRESS_LOG_INTERVAL / elapsedSec),
        String.format("%.1f", successful * 100.0 / completed),
        failed);
  }
}
