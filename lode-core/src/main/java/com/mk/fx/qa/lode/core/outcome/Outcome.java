package com.mk.fx.qa.lode.core.outcome;

import java.time.Duration;
import java.util.Objects;

/**
 * The classified result of one completed attempt.
 *
 * @param type what happened
 * @param statusCode response status, present only for {@link OutcomeType#HTTP_STATUS}
 * @param duration time from issuing the request until the response headers were parsed or the
 *     failure was observed
 */
public record Outcome(OutcomeType type, Integer statusCode, Duration duration) {

  public Outcome {
    Objects.requireNonNull(type, "type");
    duration = duration == null || duration.isNegative() ? Duration.ZERO : duration;
    if (type == OutcomeType.HTTP_STATUS && statusCode == null) {
      throw new IllegalArgumentException("HTTP_STATUS outcome requires a status code");
    }
    if (type != OutcomeType.HTTP_STATUS) {
      statusCode = null;
    }
  }

  public static Outcome success(Duration duration) {
    return new Outcome(OutcomeType.SUCCESS, null, duration);
  }

  public static Outcome httpStatus(int statusCode, Duration duration) {
    return new Outcome(OutcomeType.HTTP_STATUS, statusCode, duration);
  }

  public static Outcome timeout(Duration elapsed) {
    return new Outcome(OutcomeType.TIMEOUT, null, elapsed);
  }

  public static Outcome connectionFailed(Duration elapsed) {
    return new Outcome(OutcomeType.CONNECTION_FAILED, null, elapsed);
  }

  public boolean isSuccess() {
    return type == OutcomeType.SUCCESS;
  }
}
