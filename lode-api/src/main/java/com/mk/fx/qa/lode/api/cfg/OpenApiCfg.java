package com.mk.fx.qa.lode.api.cfg;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiCfg {

  @Bean
  public OpenAPI openApi(LodeApiProperties properties) {
    return new OpenAPI()
        .info(
            new Info()
                .title("Lode Load Generator API")
                .version(properties.getVersion())
                .description("Runs HTTP load tests and returns latency and error statistics."));
  }
}
