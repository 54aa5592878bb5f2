package com.dataexchange.domain.trades;

import com.dataexchange.domain.pools.PairKey;
import com.dataexchange.domain.pools.SwapQuote;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/** One executed swap. {@code feeAmount} is expressed in units of {@code tokenIn}. */
public record Trade(
    UUID id,
    PairKey pairKey,
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

  public Trade {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(pairKey, "pairKey must not be null");
    requireNonBlank(tokenIn, "tokenIn");
    requireNonBlank(tokenOut, "tokenOut");
    if (!pairKey.contains(tokenIn) || !pairKey.contains(tokenOut) || tokenIn.equals(tokenOut)) {
      throw new TradeDomainException(
          "tokenIn and tokenOut must be the two tokens of pool " + pairKey);
    }
    requirePositive(amountIn, "amountIn");
    requirePositive(amountOut, "amountOut");
    Objects.requireNonNull(feeAmount, "feeAmount must not be null");
    if (feeAmount.signum() < 0 || feeAmount.compareTo(amountIn) > 0) {
      throw new TradeDomainException("feeAmount must be between 0 and amountIn");
    }
    requirePositive(effectivePrice, "effectivePrice");
    requireNonBlank(trader, "trader");
    requireNonBlank(settlementReference, "settlementReference");
    Objects.requireNonNull(executedAt, "executedAt must not be null");
  }

  public static Trade executed(
      UUID id,
      PairKey pairKey,
      String tokenIn,
      SwapQuote quote,
      String trader,
      String settlementReference,
      String clientTradeId,
      Instant executedAt) {
    Objects.requireNonNull(quote, "quote must not be null");
    return new Trade(
        id,
        pairKey,
        tokenIn,
        pairKey.counterpart(tokenIn),
        quote.amountIn(),
        quote.amountOut(),
        quote.feeAmount(),
        quote.executionPrice(),
        trader,
        settlementReference,
        clientTradeId,
        executedAt);
  }

  private static void requirePositive(BigDecimal value, String fieldName) {
    if (value == null || value.signum() <= 0) {
      throw new TradeDomainException(fieldName + " must be > 0");
    }
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new TradeDomainException(fieldName + " must not be blank");
    }
  }
}
