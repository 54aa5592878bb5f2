package com.dataexchange.exchangeapi.settlement;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SettlementConfiguration {
  @Bean
  @ConditionalOnMissingBean(SettlementService.class)
  @ConditionalOnProperty(
      prefix = "amm.settlement",
      name = "mode",
      havingValue = "logging",
      matchIfMissing = true)
  SettlementService loggingSettlementService() {
    return new LoggingSettlementService();
  }
}
