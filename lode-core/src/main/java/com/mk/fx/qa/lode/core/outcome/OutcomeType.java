package com.mk.fx.qa.lode.core.outcome;

/** Classification of a completed attempt. Everything except {@link #SUCCESS} is a failure. */
public enum OutcomeType {
  SUCCESS,
  TIMEOUT,
  CONNECTION_FAILED,
  HTTP_STATUS
}
