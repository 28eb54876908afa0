package com.mk.fx.qa.lode.core.metrics;

import java.util.Map;

/**
 * Frozen aggregator state handed to the report builder.
 *
 * @param successful successful attempts
 * @param failed failed attempts
 * @param latencies success latencies; the snapshot owns this copy
 * @param latencySumNanos exact sum of success latencies
 * @param errorCounts error label to count, empty when nothing failed
 */
public record AggregateSnapshot(
    long successful,
    long failed,
    LatencyHistogram latencies,
    long latencySumNanos,
    Map<String, Long> errorCounts) {

  public AggregateSnapshot {
    errorCounts = Map.copyOf(errorCounts);
  }

  public long total() {
    return successful + failed;
  }

  /** Exact mean of success latencies in milliseconds, 0 when nothing succeeded. */
  public double meanMillis() {
    return successful == 0 ? 0.0 : latencySumNanos / (double) successful / 1_000_000.0;
  }
}
