package com.mk.fx.qa.lode.api.resource;

import com.mk.fx.qa.lode.api.cfg.LodeApiProperties;
import com.mk.fx.qa.lode.api.dto.HealthResponse;
import com.mk.fx.qa.lode.api.dto.LoadTestRequest;
import com.mk.fx.qa.lode.api.service.LoadTestService;
import com.mk.fx.qa.lode.core.LoadTestAbortedException;
import com.mk.fx.qa.lode.core.report.LoadTestReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Load Tests", description = "Run HTTP load tests and check service health")
@RestController
@Validated
@RequiredArgsConstructor
public class LoadTestController {

  private final LoadTestService loadTestService;
  private final LodeApiProperties properties;
  private final ApiResponseFactory responseFactory;

  @Operation(summary = "Health check", description = "Reports liveness and service version.")
  @GetMapping("/health")
  public ResponseEntity<HealthResponse> health() {
    log.debug("Health check requested");
    return responseFactory.ok(new HealthResponse(HealthResponse.HEALTHY, properties.getVersion()));
  }

  @Operation(
      summary = "Run a load test",
      description =
          "Issues the requested number of HTTP requests under the concurrency ceiling and returns"
              + " the final report once every request has completed.")
  @PostMapping("/load-test")
  public ResponseEntity<LoadTestReport> runLoadTest(@Valid @RequestBody LoadTestRequest request) {
    log.info(
        "Received load test {} {} requests={} concurrency={}",
        request.method(),
        request.url(),
        request.requests(),
        request.concurrency());
    try {
      return responseFactory.ok(loadTestService.run(request));
    } catch (LoadTestAbortedException ex) {
      log.warn("Load test {} aborted: {}", ex.getRunId(), ex.getMessage());
      return responseFactory.unavailable(LoadTestReport.failed(ex.getRunId()));
    }
  }
}
