package com.dataexchange.domain.pools;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record Pool(
    PairKey pairKey,
    BigDecimal reserveA,
    BigDecimal reserveB,
    BigDecimal totalLiquidityUnits,
    Instant createdAt,
    Instant updatedAt) {

  public Pool {
    Objects.requireNonNull(pairKey, "pairKey must not be null");
    requireNonNegative(reserveA, "reserveA");
    requireNonNegative(reserveB, "reserveB");
    requireNonNegative(totalLiquidityUnits, "totalLiquidityUnits");
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    Objects.requireNonNull(updatedAt, "updatedAt must not be null");
    boolean drained = reserveA.signum() == 0 && reserveB.signum() == 0;
    boolean noUnits = totalLiquidityUnits.signum() == 0;
    if (drained != noUnits) {
      throw new InvariantViolationException(
          "totalLiquidityUnits must be zero exactly when both reserves are zero: reserveA="
              + reserveA
              + ", reserveB="
              + reserveB
              + ", totalLiquidityUnits="
              + totalLiquidityUnits,
          null,
          null);
    }
  }

  public static Pool empty(PairKey pairKey, Instant now) {
    return new Pool(pairKey, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, now, now);
  }

  public boolean isEmpty() {
    return totalLiquidityUnits.signum() == 0;
  }

  public BigDecimal reserveOf(String token) {
    return pairKey.isTokenA(token) ? reserveA : reserveB;
  }

  public BigDecimal product() {
    return reserveA.multiply(reserveB);
  }

  public Pool withState(
      BigDecimal nextReserveA,
      BigDecimal nextReserveB,
      BigDecimal nextTotalLiquidityUnits,
      Instant now) {
    return new Pool(
        pairKey, nextReserveA, nextReserveB, nextTotalLiquidityUnits, createdAt, now);
  }

  private static void requireNonNegative(BigDecimal value, String fieldName) {
    if (value == null || value.signum() < 0) {
      throw new InvariantViolationException(fieldName + " must be >= 0, was " + value, null, null);
    }
  }
}
