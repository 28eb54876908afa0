package com.mk.fx.qa.lode.cli;

import com.beust.jcommander.Parameter;
import com.mk.fx.qa.lode.core.config.Header;
import com.mk.fx.qa.lode.core.config.HttpMethod;
import com.mk.fx.qa.lode.core.config.InvalidConfigException;
import com.mk.fx.qa.lode.core.config.LoadTestConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

/** Command-line options of {@code lode}. */
@Getter
public class LodeArguments {

  @Parameter(names = "--url", required = true, description = "Target URL to load test")
  private String url;

  @Parameter(
      names = {"-n", "--requests"},
      description = "Total number of requests to send")
  private int requests = 100;

  @Parameter(
      names = {"-c", "--concurrency"},
      description = "Maximum number of requests in flight")
  private int concurrency = Runtime.getRuntime().availableProcessors();

  @Parameter(
      names = {"-m", "--method"},
      description = "HTTP method: GET, POST, PUT, PATCH or DELETE")
  private String method = "GET";

  @Parameter(
      names = {"-t", "--timeout"},
      description = "Per-request timeout in seconds")
  private long timeoutSeconds = LoadTestConfig.DEFAULT_TIMEOUT.toSeconds();

  @Parameter(
      names = {"-b", "--body"},
      description = "Request body for POST, PUT and PATCH")
  private String body;

  @Parameter(
      names = {"-H", "--headers"},
      description = "Request headers as comma-separated key:value pairs; may be repeated")
  private List<String> headers = new ArrayList<>();

  @Parameter(
      names = {"-f", "--format"},
      description = "Report format: text or json")
  private OutputFormat format = OutputFormat.TEXT;

  @Parameter(names = "--verbose", description = "Log engine activity to stderr")
  private boolean verbose;

  @Parameter(
      names = {"-h", "--help"},
      help = true,
      description = "Print this help message and exit")
  private boolean help;

  /**
   * Builds the run configuration from the parsed options.
   *
   * @throws InvalidConfigException if any option is invalid
   */
  public LoadTestConfig toConfig() {
    List<Header> parsedHeaders = new ArrayList<>(headers.size());
    for (String header : headers) {
      if (!header.isBlank()) {
        parsedHeaders.add(Header.parse(header));
      }
    }
    if (timeoutSeconds < 1) {
      throw new InvalidConfigException("Invalid timeout: " + timeoutSeconds + " seconds");
    }
    return LoadTestConfig.builder()
        .url(LoadTestConfig.parseUrl(url))
        .method(HttpMethod.fromValue(method))
        .requests(requests)
        .concurrency(concurrency)
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .headers(parsedHeaders)
        .body(body)
        .build();
  }
}
