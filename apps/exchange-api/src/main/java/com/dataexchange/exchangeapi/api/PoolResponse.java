package com.dataexchange.exchangeapi.api;

import com.dataexchange.exchangeapi.pools.PoolView;
import java.math.BigDecimal;
import java.time.Instant;

public record PoolResponse(
    String pairKey,
    String tokenA,
    String tokenB,
    BigDecimal reserveA,
    BigDecimal reserveB,
    BigDecimal totalLiquidityUnits,
    BigDecimal price,
    Instant updatedAt) {
  public static PoolResponse from(PoolView view) {
    return new PoolResponse(
        view.pairKey().value(),
        view.tokenA(),
        view.tokenB(),
        view.reserveA(),
        view.reserveB(),
        view.totalLiquidityUnits(),
        view.price(),
        view.updatedAt());
  }
}
