package com.mk.fx.qa.lode.core.outcome;

import java.time.Duration;

/**
 * Unclassified result of an attempt: either a response status or the error that ended it.
 *
 * @param statusCode response status, or {@code null} when no response was received
 * @param error failure cause, or {@code null} when a response was received
 * @param elapsed measured time for the attempt
 */
public record RawResult(Integer statusCode, Throwable error, Duration elapsed) {

  public static RawResult response(int statusCode, Duration elapsed) {
    return new RawResult(statusCode, null, elapsed);
  }

  public static RawResult failure(Throwable error, Duration elapsed) {
    return new RawResult(null, error, elapsed);
  }
}
