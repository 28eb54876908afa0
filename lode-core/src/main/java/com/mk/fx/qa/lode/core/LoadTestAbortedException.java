package com.mk.fx.qa.lode.core;

import lombok.Getter;

/** Raised when a run is interrupted before every attempt completed. No report exists for it. */
@Getter
public class LoadTestAbortedException extends RuntimeException {

  private final String runId;

  public LoadTestAbortedException(String runId, String message, Throwable cause) {
    super(message, cause);
    this.runId = runId;
  }
}
