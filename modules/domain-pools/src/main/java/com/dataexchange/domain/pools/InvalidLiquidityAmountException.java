package com.dataexchange.domain.pools;

public class InvalidLiquidityAmountException extends AmmDomainException {
  public InvalidLiquidityAmountException(String message) {
    super(message);
  }
}
