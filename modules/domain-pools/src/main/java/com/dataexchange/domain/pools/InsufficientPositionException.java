package com.dataexchange.domain.pools;

import java.math.BigDecimal;

public class InsufficientPositionException extends AmmDomainException {
  private final String provider;
  private final PairKey pairKey;
  private final BigDecimal requested;
  private final BigDecimal held;

  public InsufficientPositionException(
      String provider, PairKey pairKey, BigDecimal requested, BigDecimal held) {
    super(
        String.format(
            "Insufficient liquidity position for provider %s in pool %s: requested=%s, held=%s",
            provider, pairKey, requested, held));
    this.provider = provider;
    this.pairKey = pairKey;
    this.requested = requested;
    this.held = held;
  }

  public String provider() {
    return provider;
  }

  public PairKey pairKey() {
    return pairKey;
  }

  public BigDecimal requested() {
    return requested;
  }

  public BigDecimal held() {
    return held;
  }
}
