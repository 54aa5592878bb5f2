package com.dataexchange.exchangeapi.pools;

import com.dataexchange.domain.pools.PairKey;
import com.dataexchange.domain.pools.Pool;
import com.dataexchange.domain.pools.PricingEngine;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * A pool as seen from the caller's token order. {@code price} is {@code tokenB} per {@code
 * tokenA} and null while the pool is empty.
 */
public record PoolView(
    PairKey pairKey,
    String tokenA,
    String tokenB,
    BigDecimal reserveA,
    BigDecimal reserveB,
    BigDecimal totalLiquidityUnits,
    BigDecimal price,
    Instant updatedAt) {

  public static PoolView of(Pool pool, String firstToken) {
    PairKey key = pool.pairKey();
    String first = firstToken.trim();
    String second = key.counterpart(first);
    BigDecimal reserveFirst = pool.reserveOf(first);
    BigDecimal reserveSecond = pool.reserveOf(second);
    BigDecimal price = pool.isEmpty() ? null : PricingEngine.price(reserveSecond, reserveFirst);
    return new PoolView(
        key,
        first,
        second,
        reserveFirst,
        reserveSecond,
        pool.totalLiquidityUnits(),
        price,
        pool.updatedAt());
  }

  public static PoolView canonical(Pool pool) {
    return of(pool, pool.pairKey().tokenA());
  }
}
