package com.mk.fx.qa.lode.core.outcome;

import java.net.SocketTimeoutException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Turns raw attempt results into {@link Outcome}s and renders the error labels used as keys of a
 * report's error statistics. Stateless; every method is a pure function.
 */
public final class OutcomeClassifier {

  public static final String TIMEOUT_LABEL = "timeout";
  public static final String CONNECTION_FAILED_LABEL = "connection_failed";

  private OutcomeClassifier() {
    throw new UnsupportedOperationException("OutcomeClassifier cannot be instantiated");
  }

  /**
   * Classifies a raw result. A response with a 2xx status is a success; any other status is an
   * {@link OutcomeType#HTTP_STATUS} failure. An expired request deadline maps to {@link
   * OutcomeType#TIMEOUT}; every other transport error (DNS, refused connection, connect timeout,
   * TLS, I/O) maps to {@link OutcomeType#CONNECTION_FAILED}.
   */
  public static Outcome classify(RawResult result) {
    if (result.statusCode() != null) {
      int status = result.statusCode();
      return isSuccessStatus(status)
          ? Outcome.success(result.elapsed())
          : Outcome.httpStatus(status, result.elapsed());
    }
    return isTimeout(result.error())
        ? Outcome.timeout(result.elapsed())
        : Outcome.connectionFailed(result.elapsed());
  }

  public static boolean isSuccessStatus(int status) {
    return status >= 200 && status <= 299;
  }

  /**
   * Error label of a failed outcome, e.g. {@code 500_internal_server_error}, {@code timeout}.
   *
   * @throws IllegalArgumentException for a successful outcome
   */
  public static String label(Outcome outcome) {
    return switch (outcome.type()) {
      case TIMEOUT -> TIMEOUT_LABEL;
      case CONNECTION_FAILED -> CONNECTION_FAILED_LABEL;
      case HTTP_STATUS -> statusLabel(outcome.statusCode());
      case SUCCESS -> throw new IllegalArgumentException("Successful outcomes have no error label");
    };
  }

  /** {@code <code>_<snake_case_reason>}, or the bare code when no reason phrase is registered. */
  public static String statusLabel(int statusCode) {
    return ReasonPhrases.of(statusCode)
        .map(OutcomeClassifier::snakeCase)
        .filter(phrase -> !phrase.isEmpty())
        .map(phrase -> statusCode + "_" + phrase)
        .orElse(String.valueOf(statusCode));
  }

  static String snakeCase(String phrase) {
    String lower = phrase.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
    return lower.replaceAll("^_+|_+$", "");
  }

  private static boolean isTimeout(Throwable error) {
    Throwable current = unwrap(error);
    while (current != null) {
      // bounded by the client's connect timeout, not the request deadline
      if (current instanceof HttpConnectTimeoutException) {
        return false;
      }
      if (current instanceof HttpTimeoutException
          || current instanceof SocketTimeoutException
          || current instanceof TimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
