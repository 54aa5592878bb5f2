package com.dataexchange.exchangeapi.api;

import com.dataexchange.exchangeapi.trades.TraderActivity;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

public record TraderActivityResponse(
    String trader,
    long tradeCount,
    Map<String, BigDecimal> volumeByToken,
    Instant firstTradeAt,
    Instant lastTradeAt) {
  public static TraderActivityResponse from(TraderActivity activity) {
    return new TraderActivityResponse(
        activity.trader(),
        activity.tradeCount(),
        activity.volumeByToken(),
        activity.firstTradeAt(),
        activity.lastTradeAt());
  }
}
