package com.dataexchange.domain.pools;

import java.math.BigDecimal;

public class InsufficientLiquidityException extends AmmDomainException {
  private final BigDecimal reserveIn;
  private final BigDecimal reserveOut;

  public InsufficientLiquidityException(String message, BigDecimal reserveIn, BigDecimal reserveOut) {
    super(
        String.format("%s: reserveIn=%s, reserveOut=%s", message, reserveIn, reserveOut));
    this.reserveIn = reserveIn;
    this.reserveOut = reserveOut;
  }

  public BigDecimal reserveIn() {
    return reserveIn;
  }

  public BigDecimal reserveOut() {
    return reserveOut;
  }
}
