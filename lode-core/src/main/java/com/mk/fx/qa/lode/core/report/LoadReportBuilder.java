package com.mk.fx.qa.lode.core.report;

import com.mk.fx.qa.lode.core.metrics.AggregateSnapshot;
import com.mk.fx.qa.lode.core.metrics.LatencyHistogram;
import java.time.Duration;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Assembles the final {@link LoadTestReport} from a frozen aggregate and the run's wall-clock
 * duration. Called once per run, after every attempt has been folded.
 */
@Slf4j
public final class LoadReportBuilder {

  /** Floor applied to the run duration so throughput is always defined. */
  static final double MIN_DURATION_SECONDS = 1e-6;

  public LoadTestReport build(String runId, AggregateSnapshot snapshot, Duration elapsed) {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(snapshot, "snapshot");
    Objects.requireNonNull(elapsed, "elapsed");

    double durationSec = Math.max(MIN_DURATION_SECONDS, elapsed.toNanos() / 1_000_000_000.0);
    long total = snapshot.total();
    LatencyHistogram latencies = snapshot.latencies();

    var report =
        new LoadTestReport(
            runId,
            LoadTestReport.STATUS_COMPLETED,
            total,
            snapshot.successful(),
            snapshot.failed(),
            total / durationSec,
            latencies.minMillis(),
            latencies.maxMillis(),
            snapshot.meanMillis(),
            latencies.isEmpty() ? 0.0 : latencies.percentileMillis(50),
            latencies.isEmpty() ? 0.0 : latencies.percentileMillis(95),
            latencies.isEmpty() ? 0.0 : latencies.percentileMillis(99),
            durationSec,
            snapshot.errorCounts());

    logSummary(report);
    return report;
  }

  private void logSummary(LoadTestReport r) {
    double successRate =
        r.totalRequests() == 0 ? 0.0 : r.successfulRequests() * 100.0 / r.totalRequests();
    log.info(
        "Run {} finished: duration={}s requests={} rps={} success={}% ({}/{}) latency ms"
            + " [min={} mean={} median={} p95={} p99={} max={}]",
        r.id(),
        String.format("%.3f", r.totalDurationSeconds()),
        r.totalRequests(),
        String.format("%.2f", r.requestsPerSecond()),
        String.format("%.1f", successRate),
        r.successfulRequests(),
        r.totalRequests(),
        r.minResponseTimeMs(),
        String.format("%.3f", r.meanResponseTimeMs()),
        r.medianResponseTimeMs(),
        r.p95ResponseTimeMs(),
        r.p99ResponseTimeMs(),
        r.maxResponseTimeMs());
    if (r.errorStats() != null) {
      r.errorStats()
          .forEach((label, count) -> log.info("Run {} errors {}: {}", r.id(), label, count));
    }
  }
}
