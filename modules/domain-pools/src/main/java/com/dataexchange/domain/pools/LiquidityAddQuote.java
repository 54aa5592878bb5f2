package com.dataexchange.domain.pools;

import java.math.BigDecimal;

/** Units minted for a deposit and the part of each side actually taken by the pool. */
public record LiquidityAddQuote(
    BigDecimal mintedUnits, BigDecimal consumedA, BigDecimal consumedB) {}
