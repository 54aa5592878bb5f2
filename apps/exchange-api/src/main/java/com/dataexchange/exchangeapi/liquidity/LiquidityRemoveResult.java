package com.dataexchange.exchangeapi.liquidity;

import com.dataexchange.domain.pools.PairKey;
import java.math.BigDecimal;

/** Amounts are reported in the caller's token order, {@code tokenA} first. */
public record LiquidityRemoveResult(
    PairKey pairKey,
    String tokenA,
    String tokenB,
    BigDecimal amountA,
    BigDecimal amountB,
    BigDecimal unitsBurned,
    BigDecimal remainingUnits,
    String settlementReference) {}
