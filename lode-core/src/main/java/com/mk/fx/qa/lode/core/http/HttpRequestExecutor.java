package com.mk.fx.qa.lode.core.http;

import com.mk.fx.qa.lode.core.config.Header;
import com.mk.fx.qa.lode.core.config.InvalidConfigException;
import com.mk.fx.qa.lode.core.config.LoadTestConfig;
import com.mk.fx.qa.lode.core.outcome.Outcome;
import com.mk.fx.qa.lode.core.outcome.OutcomeClassifier;
import com.mk.fx.qa.lode.core.outcome.RawResult;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Issues the configured request once per attempt over a shared JDK {@link HttpClient}.
 *
 * <p>The request is built once and reused, since {@link HttpRequest} is immutable. Each attempt is
 * timed from just before {@code sendAsync} until the status line and headers have been parsed; the
 * body is drained and discarded.
 *
 * <p>The per-request timeout bounds the whole exchange, body included. The client's own request
 * timeout only covers the wait for the response headers, so a second deadline is raced against the
 * exchange and the exchange is cancelled when it fires. Cancelling the returned future cancels the
 * exchange as well.
 */
@Slf4j
public class HttpRequestExecutor implements RequestExecutor {

  static final String CONTENT_TYPE = "Content-Type";
  static final String JSON_CONTENT_TYPE = "application/json";

  private final HttpClient httpClient;
  private final HttpRequest request;
  private final Duration timeout;
  private final String runId;

  /**
   * @param httpClient shared client, owned by the caller
   * @param config run configuration
   * @param runId run identifier used in logs
   * @throws InvalidConfigException if the request cannot be built from the configuration
   */
  public HttpRequestExecutor(HttpClient httpClient, LoadTestConfig config, String runId) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.runId = Objects.requireNonNull(runId, "runId");
    this.request = buildHttpRequest(Objects.requireNonNull(config, "config"));
    this.timeout = config.timeout();
    log.debug(
        "Run {} request prepared: {} {} timeout={} headers={} body={}",
        runId,
        config.method(),
        config.url(),
        config.timeout(),
        config.headers().size(),
        config.sendsBody());
  }

  @Override
  public CompletableFuture<Outcome> execute(int attempt) {
    var headersParsedAt = new AtomicLong();
    HttpResponse.BodyHandler<Void> handler =
        responseInfo -> {
          headersParsedAt.compareAndSet(0, System.nanoTime());
          return HttpResponse.BodySubscribers.discarding();
        };

    var startTime = System.nanoTime();
    CompletableFuture<HttpResponse<Void>> exchange;
    try {
      exchange = httpClient.sendAsync(request, handler);
    } catch (RuntimeException e) {
      var elapsed = Duration.ofNanos(System.nanoTime() - startTime);
      return CompletableFuture.completedFuture(classify(attempt, RawResult.failure(e, elapsed)));
    }

    CompletableFuture<Outcome> outcome =
        exchange
            .copy()
            .orTimeout(timeout.toNanos(), TimeUnit.NANOSECONDS)
            .handle(
                (response, error) -> {
                  if (error != null) {
                    // no-op when the exchange itself failed
                    exchange.cancel(true);
                  }
                  long stoppedAt = error == null ? headersParsedAt.get() : 0;
                  if (stoppedAt == 0) {
                    stoppedAt = System.nanoTime();
                  }
                  var elapsed = Duration.ofNanos(stoppedAt - startTime);
                  var raw =
                      error == null
                          ? RawResult.response(response.statusCode(), elapsed)
                          : RawResult.failure(error, elapsed);
                  return classify(attempt, raw);
                });
    outcome.whenComplete(
        (ignored, error) -> {
          if (error != null) {
            exchange.cancel(true);
          }
        });
    return outcome;
  }

  /** The prepared request, exposed for inspection. */
  public HttpRequest request() {
    return request;
  }

  private Outcome classify(int attempt, RawResult raw) {
    var outcome = OutcomeClassifier.classify(raw);
    if (!outcome.isSuccess()) {
      log.debug(
          "Run {} attempt {} failed as {} after {} ms{}",
          runId,
          attempt,
          OutcomeClassifier.label(outcome),
          outcome.duration().toMillis(),
          raw.error() != null ? ": " + raw.error().getMessage() : "");
    }
    return outcome;
  }

  private static HttpRequest buildHttpRequest(LoadTestConfig config) {
    try {
      var builder = HttpRequest.newBuilder().uri(config.url()).timeout(config.timeout());

      boolean hasContentType = false;
      for (Header header : config.headers()) {
        builder.header(header.name(), header.value());
        hasContentType |= CONTENT_TYPE.equalsIgnoreCase(header.name());
      }

      if (config.sendsBody()) {
        if (!hasContentType) {
          builder.header(CONTENT_TYPE, JSON_CONTENT_TYPE);
        }
        builder.method(
            config.method().name(),
            HttpRequest.BodyPublishers.ofString(config.body(), StandardCharsets.UTF_8));
      } else {
        builder.method(config.method().name(), HttpRequest.BodyPublishers.noBody());
      }
      return builder.build();
    } catch (IllegalArgumentException e) {
      throw new InvalidConfigException("Cannot build request: " + e.getMessage(), e);
    }
  }
}
