package com.dataexchange.exchangeapi.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
  @Bean
  public OpenAPI exchangeApiOpenApi(ServiceInfo serviceInfo, AmmProperties ammProperties) {
    return new OpenAPI()
        .info(
            new Info()
                .title(serviceInfo.applicationName())
                .version(serviceInfo.version())
                .description(
                    "Constant-product liquidity pools: quotes, swaps, liquidity and trade history."
                        + " Swap fee: "
                        + ammProperties.getFeeRateBps()
                        + " bps, retained by the pool."));
  }

  @Bean
  public GroupedOpenApi publicApiGroup() {
    return GroupedOpenApi.builder()
        .group("public")
        .pathsToMatch("/v1/**")
        .pathsToExclude("/v1/version")
        .build();
  }

  @Bean
  public GroupedOpenApi opsApiGroup() {
    return GroupedOpenApi.builder()
        .group("ops")
        .pathsToMatch("/v1/version", "/actuator/health", "/actuator/health/**")
        .build();
  }
}
