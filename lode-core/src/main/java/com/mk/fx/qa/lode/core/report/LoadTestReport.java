package com.mk.fx.qa.lode.core.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Final, immutable result of a load test run. Latency figures are in milliseconds and cover
 * successful requests only. {@code errorStats} is {@code null} when nothing failed.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({
  "id",
  "status",
  "total_requests",
  "successful_requests",
  "failed_requests",
  "requests_per_second",
  "min_response_time_ms",
  "max_response_time_ms",
  "mean_response_time_ms",
  "median_response_time_ms",
  "p95_response_time_ms",
  "p99_response_time_ms",
  "total_duration_seconds",
  "error_stats"
})
public record LoadTestReport(
    @JsonProperty("id") String id,
    @JsonProperty("status") String status,
    @JsonProperty("total_requests") long totalRequests,
    @JsonProperty("successful_requests") long successfulRequests,
    @JsonProperty("failed_requests") long failedRequests,
    @JsonProperty("requests_per_second") double requestsPerSecond,
    @JsonProperty("min_response_time_ms") double minResponseTimeMs,
    @JsonProperty("max_response_time_ms") double maxResponseTimeMs,
    @JsonProperty("mean_response_time_ms") double meanResponseTimeMs,
    @JsonProperty("median_response_time_ms") double medianResponseTimeMs,
    @JsonProperty("p95_response_time_ms") double p95ResponseTimeMs,
    @JsonProperty("p99_response_time_ms") double p99ResponseTimeMs,
    @JsonProperty("total_duration_seconds") double totalDurationSeconds,
    @JsonProperty("error_stats") Map<String, Long> errorStats) {

  public static final String STATUS_COMPLETED = "completed";
  public static final String STATUS_FAILED = "failed";

  public LoadTestReport {
    errorStats =
        errorStats == null || errorStats.isEmpty()
            ? null
            : Collections.unmodifiableMap(new TreeMap<>(errorStats));
  }

  /** Report for a run that could not complete: every counter and statistic is zero. */
  public static LoadTestReport failed(String id) {
    return new LoadTestReport(
        id, STATUS_FAILED, 0, 0, 0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, null);
  }

  @JsonIgnore
  public boolean isCompleted() {
    return STATUS_COMPLETED.equals(status);
  }
}
