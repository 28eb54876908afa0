package com.mk.fx.qa.lode.core.config;

/**
 * Raised when a load test cannot be started because its configuration is invalid. Always thrown
 * before any request is dispatched, so it never shows up as a failed request in a report.
 */
public class InvalidConfigException extends IllegalArgumentException {

  public InvalidConfigException(String message) {
    super(message);
  }

  public InvalidConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
