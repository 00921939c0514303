package com.mk.fx.qa.process.sync.cfg;

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
                .title("Process Sync Analyzer API")
                .description("Start, pause and stop simulated worker pools and watch their telemetry."));
  }
}
