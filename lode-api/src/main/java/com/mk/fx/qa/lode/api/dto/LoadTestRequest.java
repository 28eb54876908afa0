package com.mk.fx.qa.lode.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.Map;
import lombok.Builder;

/**
 * Body of {@code POST /load-test}.
 *
 * @param url absolute http(s) target
 * @param method GET, POST, PUT, PATCH or DELETE, case-insensitive
 * @param requests total number of requests
 * @param concurrency maximum number of requests in flight
 * @param timeoutMs per-request timeout, 5000 ms when absent
 * @param headers request headers sent with every attempt
 * @param body payload for POST, PUT and PATCH
 */
@Builder
public record LoadTestRequest(
    @NotBlank @Schema(example = "http://localhost:8080/ping") @JsonProperty("url") String url,
    @NotBlank @Schema(example = "GET") @JsonProperty("method") String method,
    @NotNull @Positive @Schema(example = "100") @JsonProperty("requests") Integer requests,
    @NotNull @Positive @Schema(example = "10") @JsonProperty("concurrency") Integer concurrency,
    @Positive @Schema(example = "5000") @JsonProperty("timeout_ms") Long timeoutMs,
    @JsonProperty("headers") Map<String, String> headers,
    @JsonProperty("body") String body) {}
