package com.mk.fx.qa.lode.api.dto;

/** Response of the health endpoint: liveness status and service version. */
public record HealthResponse(String status, String version) {

  public static final String HEALTHY = "healthy";
}
