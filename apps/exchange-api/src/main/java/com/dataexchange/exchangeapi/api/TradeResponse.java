package com.dataexchange.exchangeapi.api;

import com.dataexchange.domain.trades.Trade;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record TradeResponse(
    UUID id,
    String pairKey,
    String tokenIn,
    String tokenOut,
    BigDecimal amountIn,
    BigDecimal amountOut,
    BigDecimal feeAmount,
    BigDecimal effectivePrice,
    String trader,
    String settlementReference,
    String clientTradeId,
    Instant executedAt) {
  public static TradeResponse from(Trade trade) {
    return new TradeResponse(
        trade.id(),
        trade.pairKey().value(),
        trade.tokenIn(),
        trade.tokenOut(),
        trade.amountIn(),
        trade.amountOut(),
        trade.feeAmount(),
        trade.effectivePrice(),
        trade.trader(),
        trade.settlementReference(),
        trade.clientTradeId(),
        trade.executedAt());
  }
}
