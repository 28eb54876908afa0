package com.mk.fx.qa.lode.api.cfg;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "lode.api")
public class LodeApiProperties {

  /** Threads driving HTTP I/O and slot continuations, shared by all runs. */
  @Min(1)
  @Max(256)
  private int workerThreads = Math.max(2, Runtime.getRuntime().availableProcessors());

  /** Connect timeout applied by the shared HTTP client, in milliseconds. */
  @Min(1)
  private long connectTimeoutMs = 10_000;

  /** Origin allowed by the CORS policy; {@code *} allows any. */
  @NotBlank private String corsOrigin = "*";

  /** Version reported by the health endpoint. */
  @NotBlank private String version = "0.1.0";
}
