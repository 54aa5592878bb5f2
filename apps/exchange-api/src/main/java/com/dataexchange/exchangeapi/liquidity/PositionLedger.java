package com.dataexchange.exchangeapi.liquidity;

import com.dataexchange.domain.pools.PairKey;
import java.math.BigDecimal;
import java.util.List;

/** Liquidity units owned by each provider, per pool. Written only under the pool lock. */
public interface PositionLedger {
  BigDecimal unitsHeld(PairKey pairKey, String provider);

  /** Adds units and returns the provider's new balance. */
  BigDecimal credit(PairKey pairKey, String provider, BigDecimal units);

  /**
   * Removes units and returns the provider's remaining balance.
   *
   * @throws com.dataexchange.domain.pools.InsufficientPositionException when fewer units are held
   */
  BigDecimal debit(PairKey pairKey, String provider, BigDecimal units);

  /** Non-zero holdings of a provider across all pools. */
  List<PositionHolding> holdingsOf(String provider);
}
