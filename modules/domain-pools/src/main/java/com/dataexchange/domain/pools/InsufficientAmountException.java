package com.dataexchange.domain.pools;

public class InsufficientAmountException extends AmmDomainException {
  public InsufficientAmountException(String message) {
    super(message);
  }
}
