package com.dataexchange.exchangeapi.api;

import com.dataexchange.exchangeapi.liquidity.LiquidityAddResult;
import java.math.BigDecimal;

public record AddLiquidityResponse(
    String pairKey,
    String tokenA,
    String tokenB,
    BigDecimal mintedUnits,
    BigDecimal consumedA,
    BigDecimal consumedB,
    BigDecimal unusedA,
    BigDecimal unusedB,
    BigDecimal providerUnits,
    String settlementReference) {
  public static AddLiquidityResponse from(LiquidityAddResult result) {
    return new AddLiquidityResponse(
        result.pairKey().value(),
        result.tokenA(),
        result.tokenB(),
        result.mintedUnits(),
        result.consumedA(),
        result.consumedB(),
        result.unusedA(),
        result.unusedB(),
        result.providerUnits(),
        result.settlementReference());
  }
}
