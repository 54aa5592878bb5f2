package com.dataexchange.exchangeapi.api;

import com.dataexchange.exchangeapi.trades.PoolActivity;
import java.math.BigDecimal;
import java.time.Instant;

public record PoolActivityResponse(
    String pairKey,
    Instant since,
    long tradeCount,
    BigDecimal volumeA,
    BigDecimal volumeB,
    BigDecimal feesA,
    BigDecimal feesB,
    BigDecimal lastPrice,
    Instant lastTradeAt) {
  public static PoolActivityResponse from(PoolActivity activity) {
    return new PoolActivityResponse(
        activity.pairKey().value(),
        activity.since(),
        activity.tradeCount(),
        activity.volumeA(),
        activity.volumeB(),
        activity.feesA(),
        activity.feesB(),
        activity.lastPrice(),
        activity.lastTradeAt());
  }
}
