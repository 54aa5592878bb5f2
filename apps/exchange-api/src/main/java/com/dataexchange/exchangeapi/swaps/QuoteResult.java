package com.dataexchange.exchangeapi.swaps;

import com.dataexchange.domain.pools.PairKey;
import java.math.BigDecimal;

public record QuoteResult(
    PairKey pairKey,
    String tokenIn,
    String tokenOut,
    BigDecimal amountIn,
    BigDecimal amountOut,
    BigDecimal feeAmount,
    BigDecimal priceImpactPct,
    BigDecimal spotPrice,
    BigDecimal executionPrice,
    BigDecimal reserveIn,
    BigDecimal reserveOut) {}
