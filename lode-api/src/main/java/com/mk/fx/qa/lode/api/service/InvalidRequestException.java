package com.mk.fx.qa.lode.api.service;

import com.mk.fx.qa.lode.core.config.InvalidConfigException;
import lombok.Getter;

/** A load test request rejected before any work is dispatched; {@code title} names the field. */
@Getter
public class InvalidRequestException extends InvalidConfigException {

  private final String title;

  public InvalidRequestException(String title, InvalidConfigException cause) {
    super(cause.getMessage(), cause);
    this.title = title;
  }
}
