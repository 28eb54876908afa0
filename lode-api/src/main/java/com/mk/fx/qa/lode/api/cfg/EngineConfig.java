package com.mk.fx.qa.lode.api.cfg;

import com.mk.fx.qa.lode.core.EngineSettings;
import com.mk.fx.qa.lode.core.LoadTestEngine;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

  @Bean(destroyMethod = "close")
  public LoadTestEngine loadTestEngine(LodeApiProperties properties) {
    return new LoadTestEngine(
        new EngineSettings(
            properties.getWorkerThreads(), Duration.ofMillis(properties.getConnectTimeoutMs())));
  }
}
