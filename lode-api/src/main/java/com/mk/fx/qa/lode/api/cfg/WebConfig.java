package com.mk.fx.qa.lode.api.cfg;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** CORS policy: one configurable origin, any method and header, one hour preflight cache. */
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

  static final long CORS_MAX_AGE_SECONDS = 3600;

  private final LodeApiProperties properties;

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry
        .addMapping("/**")
        .allowedOrigins(properties.getCorsOrigin())
        .allowedMethods("*")
        .allowedHeaders("*")
        .maxAge(CORS_MAX_AGE_SECONDS);
  }
}
