package com.dataexchange.exchangeapi.settlement;

import java.math.BigDecimal;
import java.util.Objects;

/** One token movement. {@code TO_POOL} is paid by the party, {@code FROM_POOL} is paid to it. */
public record SettlementLeg(String token, BigDecimal amount, Direction direction) {
  public enum Direction {
    TO_POOL,
    FROM_POOL
  }

  public SettlementLeg {
    Objects.requireNonNull(token, "token must not be null");
    Objects.requireNonNull(amount, "amount must not be null");
    Objects.requireNonNull(direction, "direction must not be null");
    if (amount.signum() < 0) {
      throw new IllegalArgumentException("settlement amount must be >= 0");
    }
  }
}
