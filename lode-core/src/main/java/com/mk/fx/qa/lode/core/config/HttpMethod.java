package com.mk.fx.qa.lode.core.config;

import java.util.Arrays;
import java.util.Locale;

/** HTTP methods the load generator can issue. */
public enum HttpMethod {
  GET(false),
  POST(true),
  PUT(true),
  PATCH(true),
  DELETE(false);

  private final boolean acceptsBody;

  HttpMethod(boolean acceptsBody) {
    this.acceptsBody = acceptsBody;
  }

  /** Whether a configured request body is attached for this method. */
  public boolean acceptsBody() {
    return acceptsBody;
  }

  /**
   * Resolves a method name case-insensitively.
   *
   * @throws InvalidConfigException if the value is blank or not a supported method
   */
  public static HttpMethod fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new InvalidConfigException("HTTP method is required");
    }
    String normalised = value.trim().toUpperCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(method -> method.name().equals(normalised))
        .findFirst()
        .orElseThrow(
            () ->
                new InvalidConfigException(
                    "Unsupported HTTP method: "
                        + value
                        + ". Allowed: "
                        + Arrays.toString(values())));
  }
}
