package com.dataexchange.domain.pools;

import java.math.BigDecimal;

public record SwapQuote(
    BigDecimal amountIn,
    BigDecimal effectiveIn,
    BigDecimal feeAmount,
    BigDecimal amountOut,
    BigDecimal spotPrice,
    BigDecimal executionPrice,
    BigDecimal priceImpactPct) {}
