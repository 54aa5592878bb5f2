package com.dataexchange.exchangeapi.settlement;

public class SettlementException extends RuntimeException {
  public SettlementException(String message) {
    super(message);
  }

  public SettlementException(String message, Throwable cause) {
    super(message, cause);
  }
}
