package com.dataexchange.domain.pools;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Constant-product pricing. Every function is pure and works on exact decimals.
 *
 * <p>Quantities are carried with {@value #SCALE} decimal places. Results that leave the pool
 * (swap output, minted units, withdrawal payouts) round down; amounts the pool takes in round up,
 * so rounding can only ever grow the reserve product. Prices are ratios, not pool quantities: they
 * keep {@code 40} significant digits so that a pair quoted far below {@code 1e-18} still reports a
 * positive price.
 */
public final class PricingEngine {
  public static final int SCALE = 18;
  public static final int BPS_DENOMINATOR = 10_000;

  private static final MathContext MC = new MathContext(40, RoundingMode.HALF_EVEN);
  private static final int PRICE_IMPACT_SCALE = 8;
  private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

  private PricingEngine() {}

  public static SwapQuote quoteSwap(
      BigDecimal reserveIn, BigDecimal reserveOut, BigDecimal amountIn, int feeRateBps) {
    requireFeeRate(feeRateBps);
    requireAmount(amountIn, "amountIn");
    requireReserves(reserveIn, reserveOut);

    BigDecimal effectiveIn =
        amountIn
            .multiply(BigDecimal.valueOf(BPS_DENOMINATOR - (long) feeRateBps))
            .movePointLeft(4)
            .setScale(SCALE, RoundingMode.DOWN);
    BigDecimal feeAmount = amountIn.subtract(effectiveIn);
    BigDecimal amountOut =
        reserveOut
            .multiply(effectiveIn)
            .divide(reserveIn.add(effectiveIn), SCALE, RoundingMode.DOWN);

    if (amountOut.signum() <= 0) {
      throw new InsufficientAmountException(
          "amountIn " + amountIn + " is too small to produce any output");
    }
    if (amountOut.compareTo(reserveOut) >= 0) {
      throw new InsufficientLiquidityException(
          "Trade would drain the output reserve", reserveIn, reserveOut);
    }

    BigDecimal spotPrice = price(reserveOut, reserveIn);
    BigDecimal executionPrice = price(amountOut, amountIn);
    BigDecimal priceImpactPct =
        executionPrice
            .subtract(spotPrice)
            .abs()
            .divide(spotPrice, MC)
            .multiply(ONE_HUNDRED)
            .setScale(PRICE_IMPACT_SCALE, RoundingMode.HALF_UP);

    return new SwapQuote(
        amountIn,
        effectiveIn,
        feeAmount,
        amountOut,
        spotPrice,
        executionPrice,
        priceImpactPct);
  }

  /** Units of {@code quoteAmount} paid per unit of {@code baseAmount}. */
  public static BigDecimal price(BigDecimal quoteAmount, BigDecimal baseAmount) {
    return quoteAmount.divide(baseAmount, MC);
  }

  /**
   * Units minted for a deposit. The first deposit sets the exchange rate and mints {@code
   * sqrt(amountA * amountB)}; later deposits must match the pool ratio within {@code
   * ratioTolerance} and only the ratio-matching part of the over-supplied side is consumed.
   */
  public static LiquidityAddQuote quoteLiquidityAdd(
      BigDecimal reserveA,
      BigDecimal reserveB,
      BigDecimal totalLiquidity,
      BigDecimal amountA,
      BigDecimal amountB,
      BigDecimal ratioTolerance) {
    requireAmount(amountA, "amountA");
    requireAmount(amountB, "amountB");
    if (ratioTolerance == null || ratioTolerance.signum() < 0) {
      throw new IllegalArgumentException("ratioTolerance must be >= 0");
    }

    if (totalLiquidity.signum() == 0) {
      BigDecimal minted = amountA.multiply(amountB).sqrt(MC).setScale(SCALE, RoundingMode.DOWN);
      if (minted.signum() <= 0) {
        throw new InsufficientAmountException("Initial deposit is too small to mint any units");
      }
      return new LiquidityAddQuote(minted, amountA, amountB);
    }
    requireReserves(reserveA, reserveB);

    BigDecimal poolRatio = reserveB.divide(reserveA, MC);
    BigDecimal depositRatio = amountB.divide(amountA, MC);
    BigDecimal deviation = depositRatio.subtract(poolRatio).abs().divide(poolRatio, MC);
    if (deviation.compareTo(ratioTolerance) > 0) {
      throw new InvalidLiquidityAmountException(
          String.format(
              "Deposit ratio %s deviates from pool ratio %s by %s, tolerance is %s",
              depositRatio.round(MathContext.DECIMAL64),
              poolRatio.round(MathContext.DECIMAL64),
              deviation.round(MathContext.DECIMAL64),
              ratioTolerance));
    }

    BigDecimal shareA = amountA.divide(reserveA, MC);
    BigDecimal shareB = amountB.divide(reserveB, MC);
    BigDecimal consumedA;
    BigDecimal consumedB;
    BigDecimal minted;
    if (shareA.compareTo(shareB) <= 0) {
      consumedA = amountA;
      consumedB =
          amountA.multiply(reserveB).divide(reserveA, SCALE, RoundingMode.UP).min(amountB);
      minted = amountA.multiply(totalLiquidity).divide(reserveA, SCALE, RoundingMode.DOWN);
    } else {
      consumedB = amountB;
      consumedA =
          amountB.multiply(reserveA).divide(reserveB, SCALE, RoundingMode.UP).min(amountA);
      minted = amountB.multiply(totalLiquidity).divide(reserveB, SCALE, RoundingMode.DOWN);
    }
    if (minted.signum() <= 0) {
      throw new InsufficientAmountException("Deposit is too small to mint any units");
    }
    return new LiquidityAddQuote(minted, consumedA, consumedB);
  }

  public static LiquidityRemoveQuote quoteLiquidityRemove(
      BigDecimal reserveA, BigDecimal reserveB, BigDecimal totalLiquidity, BigDecimal unitsToBurn) {
    if (unitsToBurn == null || unitsToBurn.signum() <= 0) {
      throw new InvalidLiquidityAmountException("unitsToBurn must be > 0");
    }
    if (unitsToBurn.compareTo(totalLiquidity) > 0) {
      throw new InvalidLiquidityAmountException(
          "unitsToBurn " + unitsToBurn + " exceeds total liquidity " + totalLiquidity);
    }
    if (unitsToBurn.compareTo(totalLiquidity) == 0) {
      return new LiquidityRemoveQuote(reserveA, reserveB);
    }
    BigDecimal amountA =
        reserveA.multiply(unitsToBurn).divide(totalLiquidity, SCALE, RoundingMode.DOWN);
    BigDecimal amountB =
        reserveB.multiply(unitsToBurn).divide(totalLiquidity, SCALE, RoundingMode.DOWN);
    return new LiquidityRemoveQuote(amountA, amountB);
  }

  /** Fails when a swap left the pool with a smaller reserve product than it started with. */
  public static void checkProductInvariant(Pool before, Pool after) {
    BigDecimal productBefore = before.product();
    BigDecimal productAfter = after.product();
    if (productAfter.compareTo(productBefore) < 0) {
      throw new InvariantViolationException(
          "Reserve product decreased from " + productBefore + " to " + productAfter,
          before,
          after);
    }
  }

  /** Rejects non-positive amounts and amounts finer than the supported precision. */
  public static BigDecimal requireAmount(BigDecimal amount, String fieldName) {
    if (amount == null || amount.signum() <= 0) {
      throw new InsufficientAmountException(fieldName + " must be > 0");
    }
    if (amount.stripTrailingZeros().scale() > SCALE) {
      throw new InsufficientAmountException(
          fieldName + " supports at most " + SCALE + " decimal places");
    }
    return amount;
  }

  private static void requireReserves(BigDecimal reserveIn, BigDecimal reserveOut) {
    if (reserveIn == null
        || reserveOut == null
        || reserveIn.signum() <= 0
        || reserveOut.signum() <= 0) {
      throw new InsufficientLiquidityException("Pool has no liquidity", reserveIn, reserveOut);
    }
  }

  private static void requireFeeRate(int feeRateBps) {
    if (feeRateBps < 0 || feeRateBps >= BPS_DENOMINATOR) {
      throw new IllegalArgumentException(
          "feeRateBps must be in [0, " + BPS_DENOMINATOR + "), was " + feeRateBps);
    }
  }
}
