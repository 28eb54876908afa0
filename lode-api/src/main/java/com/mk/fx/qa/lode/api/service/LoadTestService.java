package com.mk.fx.qa.lode.api.service;

import com.mk.fx.qa.lode.api.dto.LoadTestRequest;
import com.mk.fx.qa.lode.core.LoadTestEngine;
import com.mk.fx.qa.lode.core.config.LoadTestConfig;
import com.mk.fx.qa.lode.core.report.LoadTestReport;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs load tests on behalf of the REST layer. Each call blocks the calling request thread until
 * its run completes; concurrent calls run independently on the shared engine.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoadTestService {

  private final LoadTestEngine engine;
  private final LoadTestRequestMapper mapper;
  private final AtomicInteger activeRuns = new AtomicInteger();

  /**
   * @throws InvalidRequestException if a field of the request is malformed
   * @throws com.mk.fx.qa.lode.core.config.InvalidConfigException if counts or timeout are invalid
   * @throws com.mk.fx.qa.lode.core.LoadTestAbortedException if the run is interrupted
   */
  public LoadTestReport run(LoadTestRequest request) {
    LoadTestConfig config = mapper.toConfig(request);
    int active = activeRuns.incrementAndGet();
    if (active > 1) {
      log.warn("{} load tests running concurrently; results will share client resources", active);
    }
    try {
      return engine.run(config);
    } finally {
      activeRuns.decrementAndGet();
    }
  }

  public int activeRuns() {
    return activeRuns.get();
  }
}
