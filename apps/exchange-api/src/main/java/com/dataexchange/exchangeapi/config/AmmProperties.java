package com.dataexchange.exchangeapi.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/** Engine settings, checked at startup. */
@Component
@Validated
@ConfigurationProperties(prefix = "amm")
public class AmmProperties {
  /** Swap fee in basis points, retained by the pool. */
  @Min(0)
  @Max(9999)
  private int feeRateBps = 30;

  /** Maximum relative deviation of a deposit ratio from the pool ratio. */
  @NotNull
  @DecimalMin("0")
  @DecimalMax("1")
  private BigDecimal liquidityRatioTolerance = new BigDecimal("0.01");

  /** Upper bound on waiting for a pool row lock. */
  @NotNull private Duration poolLockTimeout = Duration.ofSeconds(5);

  @Min(1)
  private int maxPageSize = 100;

  public int getFeeRateBps() {
    return feeRateBps;
  }

  public void setFeeRateBps(int feeRateBps) {
    this.feeRateBps = feeRateBps;
  }

  public BigDecimal getLiquidityRatioTolerance() {
    return liquidityRatioTolerance;
  }

  public void setLiquidityRatioTolerance(BigDecimal liquidityRatioTolerance) {
    this.liquidityRatioTolerance = liquidityRatioTolerance;
  }

  public Duration getPoolLockTimeout() {
    return poolLockTimeout;
  }

  public void setPoolLockTimeout(Duration poolLockTimeout) {
    this.poolLockTimeout = poolLockTimeout;
  }

  public int getMaxPageSize() {
    return maxPageSize;
  }

  public void setMaxPageSize(int maxPageSize) {
    this.maxPageSize = maxPageSize;
  }

  public int clampLimit(int limit) {
    return Math.min(Math.max(limit, 1), Math.max(maxPageSize, 1));
  }
}
