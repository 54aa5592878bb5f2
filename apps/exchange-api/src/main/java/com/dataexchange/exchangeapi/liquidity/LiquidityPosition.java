package com.dataexchange.exchangeapi.liquidity;

import com.dataexchange.domain.pools.PairKey;
import java.math.BigDecimal;

/** A holding valued at current reserves: what burning all {@code units} would pay out now. */
public record LiquidityPosition(
    PairKey pairKey, String provider, BigDecimal units, BigDecimal shareA, BigDecimal shareB) {}
