package com.dataexchange.domain.pools;

import java.math.BigDecimal;

public record LiquidityRemoveQuote(BigDecimal amountA, BigDecimal amountB) {}
