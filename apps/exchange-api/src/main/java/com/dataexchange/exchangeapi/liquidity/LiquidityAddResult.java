package com.dataexchange.exchangeapi.liquidity;

import com.dataexchange.domain.pools.PairKey;
import java.math.BigDecimal;

/** Amounts are reported in the caller's token order, {@code tokenA} first. */
public record LiquidityAddResult(
    PairKey pairKey,
    String tokenA,
    String tokenB,
    BigDecimal mintedUnits,
    BigDecimal consumedA,
    BigDecimal consumedB,
    BigDecimal unusedA,
    BigDecimal unusedB,
    BigDecimal providerUnits,
    String settlementReference) {}
