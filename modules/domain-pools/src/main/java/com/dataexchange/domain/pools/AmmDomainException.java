package com.dataexchange.domain.pools;

public class AmmDomainException extends RuntimeException {
  public AmmDomainException(String message) {
    super(message);
  }
}
