package com.mk.fx.qa.lode.api;

import com.mk.fx.qa.lode.api.cfg.LodeApiProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(LodeApiProperties.class)
public class LodeApiApplication {

  public static void main(String[] args) {
    SpringApplication.run(LodeApiApplication.class, args);
  }
}
