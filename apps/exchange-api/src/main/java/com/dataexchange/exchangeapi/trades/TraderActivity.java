package com.dataexchange.exchangeapi.trades;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/** Lifetime activity of one trader. {@code volumeByToken} sums amounts sold, keyed by tokenIn. */
public record TraderActivity(
    String trader,
    long tradeCount,
    Map<String, BigDecimal> volumeByToken,
    Instant firstTradeAt,
    Instant lastTradeAt) {

  public TraderActivity {
    volumeByToken = volumeByToken == null ? Map.of() : volumeByToken;
  }
}
