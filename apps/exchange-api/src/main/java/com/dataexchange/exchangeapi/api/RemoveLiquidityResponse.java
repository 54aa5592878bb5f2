package com.dataexchange.exchangeapi.api;

import com.dataexchange.exchangeapi.liquidity.LiquidityRemoveResult;
import java.math.BigDecimal;

public record RemoveLiquidityResponse(
    String pairKey,
    String tokenA,
    String tokenB,
    BigDecimal amountA,
    BigDecimal amountB,
    BigDecimal unitsBurned,
    BigDecimal remainingUnits,
    String settlementReference) {
  public static RemoveLiquidityResponse from(LiquidityRemoveResult result) {
    return new RemoveLiquidityResponse(
        result.pairKey().value(),
        result.tokenA(),
        result.tokenB(),
        result.amountA(),
        result.amountB(),
        result.unitsBurned(),
        result.remainingUnits(),
        result.settlementReference());
  }
}
