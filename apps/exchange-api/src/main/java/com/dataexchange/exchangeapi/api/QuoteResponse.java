package com.dataexchange.exchangeapi.api;

import com.dataexchange.exchangeapi.swaps.QuoteResult;
import java.math.BigDecimal;

public record QuoteResponse(
    String pairKey,
    String tokenIn,
    String tokenOut,
    BigDecimal amountIn,
    BigDecimal amountOut,
    BigDecimal feeAmount,
    BigDecimal priceImpactPct,
    BigDecimal spotPrice,
    BigDecimal executionPrice,
    BigDecimal reserveIn,
    BigDecimal reserveOut) {
  public static QuoteResponse from(QuoteResult quote) {
    return new QuoteResponse(
        quote.pairKey().value(),
        quote.tokenIn(),
        quote.tokenOut(),
        quote.amountIn(),
        quote.amountOut(),
        quote.feeAmount(),
        quote.priceImpactPct(),
        quote.spotPrice(),
        quote.executionPrice(),
        quote.reserveIn(),
        quote.reserveOut());
  }
}
