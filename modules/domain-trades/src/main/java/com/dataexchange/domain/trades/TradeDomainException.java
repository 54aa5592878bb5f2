package com.dataexchange.domain.trades;

public class TradeDomainException extends RuntimeException {
  public TradeDomainException(String message) {
    super(message);
  }
}
