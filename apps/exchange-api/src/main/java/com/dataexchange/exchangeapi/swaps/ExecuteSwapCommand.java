package com.dataexchange.exchangeapi.swaps;

import java.math.BigDecimal;

/**
 * A swap request. {@code minAmountOut} is the caller's slippage floor; {@code clientTradeId}, when
 * set, makes resubmission of the same request return the original trade.
 */
public record ExecuteSwapCommand(
    String tokenIn,
    String tokenOut,
    BigDecimal amountIn,
    BigDecimal minAmountOut,
    String trader,
    String clientTradeId) {}
