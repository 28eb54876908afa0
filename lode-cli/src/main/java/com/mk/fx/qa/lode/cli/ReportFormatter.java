package com.mk.fx.qa.lode.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mk.fx.qa.lode.core.report.LoadTestReport;
import java.util.Locale;
import java.util.Map;

/** Renders a {@link LoadTestReport} for the terminal. */
public final class ReportFormatter {

  private static final ObjectMapper JSON =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private ReportFormatter() {
    throw new UnsupportedOperationException("ReportFormatter cannot be instantiated");
  }

  public static String format(LoadTestReport report, OutputFormat format) {
    return format == OutputFormat.JSON ? json(report) : text(report);
  }

  /** Pretty JSON with the same field names the REST service returns. */
  public static String json(LoadTestReport report) {
    try {
      return JSON.writeValueAsString(report);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialise report " + report.id(), e);
    }
  }

  public static String text(LoadTestReport report) {
    var sb = new StringBuilder();
    sb.append("Load Test Report\n");
    sb.append("----------------\n");
    line(sb, "Run", report.id());
    line(sb, "Total Requests", report.totalRequests());
    line(sb, "Successful Requests", report.successfulRequests());
    line(sb, "Failed Requests", report.failedRequests());
    line(sb, "Requests/second", String.format(Locale.ROOT, "%.2f", report.requestsPerSecond()));
    sb.append('\n');
    sb.append("Response Time (ms)\n");
    sb.append("------------------\n");
    line(sb, "Min", millis(report.minResponseTimeMs()));
    line(sb, "Max", millis(report.maxResponseTimeMs()));
    line(sb, "Mean", millis(report.meanResponseTimeMs()));
    line(sb, "Median", millis(report.medianResponseTimeMs()));
    line(sb, "P95", millis(report.p95ResponseTimeMs()));
    line(sb, "P99", millis(report.p99ResponseTimeMs()));
    sb.append('\n');
    line(
        sb,
        "Total Duration",
        String.format(Locale.ROOT, "%.2f seconds", report.totalDurationSeconds()));

    Map<String, Long> errors = report.errorStats();
    if (errors != null) {
      sb.append('\n');
      sb.append("Errors\n");
      sb.append("------\n");
      errors.forEach((label, count) -> line(sb, label, count));
    }
    return sb.toString();
  }

  private static void line(StringBuilder sb, String name, Object value) {
    sb.append(name).append(": ").append(value).append('\n');
  }

  private static String millis(double value) {
    return String.format(Locale.ROOT, "%.3f", value);
  }
}
