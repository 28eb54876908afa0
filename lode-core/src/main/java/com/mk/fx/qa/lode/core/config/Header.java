package com.mk.fx.qa.lode.core.config;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A single request header. Headers are kept as an ordered list of pairs so the same name may
 * appear more than once.
 *
 * @param name header name, an HTTP token
 * @param value header value, may be empty
 */
public record Header(String name, String value) {

  private static final Pattern TOKEN = Pattern.compile("[!#$%&'*+\\-.^_`|~0-9A-Za-z]+");

  /** Headers the JDK client manages itself and refuses to accept from callers. */
  private static final Set<String> RESTRICTED =
      Set.of("connection", "content-length", "expect", "host", "upgrade");

  public Header {
    if (name == null || name.isBlank()) {
      throw new InvalidConfigException("Header name must not be blank");
    }
    name = name.trim();
    if (!TOKEN.matcher(name).matches()) {
      throw new InvalidConfigException("Header name '" + name + "' contains invalid characters");
    }
    if (RESTRICTED.contains(name.toLowerCase(Locale.ROOT))) {
      throw new InvalidConfigException("Header '" + name + "' is managed by the HTTP client");
    }
    value = value == null ? "" : value.trim();
  }

  /**
   * Parses a {@code key:value} pair, splitting on the first colon.
   *
   * @throws InvalidConfigException if the text has no colon or an invalid name
   */
  public static Header parse(String text) {
    if (text == null) {
      throw new InvalidConfigException("Invalid header format: null");
    }
    int separator = text.indexOf(':');
    if (separator <= 0) {
      throw new InvalidConfigException("Invalid header format: " + text);
    }
    return new Header(text.substring(0, separator), text.substring(separator + 1));
  }
}
