package com.mk.fx.qa.lode.core.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.List;
import lombok.Builder;

/**
 * Immutable description of a single load test run. Instances are validated on construction, so a
 * config that exists is always runnable.
 *
 * @param url absolute http(s) target
 * @param method HTTP method issued for every attempt
 * @param requests total number of work units, at least 1
 * @param concurrency concurrency ceiling, at least 1; values above {@code requests} are capped
 * @param timeout per-attempt timeout, defaults to {@link #DEFAULT_TIMEOUT}
 * @param headers ordered request headers, duplicates allowed
 * @param body optional payload, sent only for methods that accept one
 */
@Builder(toBuilder = true)
public record LoadTestConfig(
    URI url,
    HttpMethod method,
    int requests,
    int concurrency,
    Duration timeout,
    List<Header> headers,
    String body) {

  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  public LoadTestConfig {
    if (url == null) {
      throw new InvalidConfigException("URL is required");
    }
    validateUrl(url);
    if (method == null) {
      throw new InvalidConfigException("HTTP method is required");
    }
    if (requests < 1) {
      throw new InvalidConfigException("Invalid number of requests: " + requests);
    }
    if (concurrency < 1) {
      throw new InvalidConfigException("Invalid concurrency: " + concurrency);
    }
    timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
    if (timeout.isZero() || timeout.isNegative()) {
      throw new InvalidConfigException("Invalid timeout: " + timeout);
    }
    headers = headers != null ? List.copyOf(headers) : List.of();
  }

  /** Number of slots actually run: the ceiling, capped at the amount of work. */
  public int effectiveConcurrency() {
    return Math.min(concurrency, requests);
  }

  /** Whether {@link #body()} is attached to outgoing requests. */
  public boolean sendsBody() {
    return body != null && method.acceptsBody();
  }

  /**
   * Parses and validates a target URL.
   *
   * @throws InvalidConfigException if the text is not an absolute http(s) URI with a host
   */
  public static URI parseUrl(String url) {
    if (url == null || url.isBlank()) {
      throw new InvalidConfigException("URL is required");
    }
    try {
      URI uri = new URI(url.trim());
      validateUrl(uri);
      return uri;
    } catch (URISyntaxException e) {
      throw new InvalidConfigException("Invalid URL: " + e.getMessage(), e);
    }
  }

  private static void validateUrl(URI uri) {
    String scheme = uri.getScheme();
    if (!uri.isAbsolute() || scheme == null) {
      throw new InvalidConfigException("Invalid URL: " + uri + " is not absolute");
    }
    if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
      throw new InvalidConfigException("Invalid URL: unsupported scheme '" + scheme + "'");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new InvalidConfigException("Invalid URL: " + uri + " has no host");
    }
  }
}
