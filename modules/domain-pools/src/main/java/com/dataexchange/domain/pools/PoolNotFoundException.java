package com.dataexchange.domain.pools;

public class PoolNotFoundException extends AmmDomainException {
  private final PairKey pairKey;

  public PoolNotFoundException(PairKey pairKey) {
    super("Pool not found: " + pairKey);
    this.pairKey = pairKey;
  }

  public PairKey pairKey() {
    return pairKey;
  }
}
