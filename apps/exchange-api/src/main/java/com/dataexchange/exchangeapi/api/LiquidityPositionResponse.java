package com.dataexchange.exchangeapi.api;

import com.dataexchange.exchangeapi.liquidity.LiquidityPosition;
import java.math.BigDecimal;

public record LiquidityPositionResponse(
    String pairKey,
    String tokenA,
    String tokenB,
    BigDecimal units,
    BigDecimal shareA,
    BigDecimal shareB) {
  public static LiquidityPositionResponse from(LiquidityPosition position) {
    return new LiquidityPositionResponse(
        position.pairKey().value(),
        position.pairKey().tokenA(),
        position.pairKey().tokenB(),
        position.units(),
        position.shareA(),
        position.shareB());
  }
}
