package com.dataexchange.domain.pools;

import java.math.BigDecimal;

/** Live output fell below the caller's minimum. Re-quote and retry. */
public class SlippageExceededException extends AmmDomainException {
  private final BigDecimal minAmountOut;
  private final BigDecimal actualAmountOut;

  public SlippageExceededException(BigDecimal minAmountOut, BigDecimal actualAmountOut) {
    super(
        String.format(
            "Slippage exceeded: minAmountOut=%s, actualAmountOut=%s",
            minAmountOut, actualAmountOut));
    this.minAmountOut = minAmountOut;
    this.actualAmountOut = actualAmountOut;
  }

  public BigDecimal minAmountOut() {
    return minAmountOut;
  }

  public BigDecimal actualAmountOut() {
    return actualAmountOut;
  }
}
