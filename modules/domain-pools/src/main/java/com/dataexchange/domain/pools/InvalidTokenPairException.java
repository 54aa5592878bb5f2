package com.dataexchange.domain.pools;

public class InvalidTokenPairException extends AmmDomainException {
  public InvalidTokenPairException(String message) {
    super(message);
  }
}
