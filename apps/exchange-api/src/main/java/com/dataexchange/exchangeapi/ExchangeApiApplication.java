package com.dataexchange.exchangeapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExchangeApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(ExchangeApiApplication.class, args);
  }
}
