package com.mk.fx.qa.load.telemetry.cfg;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiCfg {

  @Bean
  public OpenAPI openApi() {
    return new OpenAPI()
        .info(
            new Info()
                .title("Load Telemetry Pipeline API")
                .description(
                    "API for normalizing load-test telemetry and preparing downsampled series."));
  }
}
