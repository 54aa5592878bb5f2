package com.dataexchange.exchangeapi.trades;

import com.dataexchange.domain.pools.PairKey;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Trading activity of one pool since a point in time. Volumes count both directions; fees are in
 * the token they were charged in. {@code lastPrice} is tokenB per tokenA of the latest trade and
 * is null when there was none.
 */
public record PoolActivity(
    PairKey pairKey,
    Instant since,
    long tradeCount,
    BigDecimal volumeA,
    BigDecimal volumeB,
    BigDecimal feesA,
    BigDecimal feesB,
    BigDecimal lastPrice,
    Instant lastTradeAt) {}
