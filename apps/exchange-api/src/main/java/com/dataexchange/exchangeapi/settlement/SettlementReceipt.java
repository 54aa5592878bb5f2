package com.dataexchange.exchangeapi.settlement;

import java.time.Instant;
import java.util.Objects;

public record SettlementReceipt(String reference, Instant settledAt) {
  public SettlementReceipt {
    if (reference == null || reference.isBlank()) {
      throw new IllegalArgumentException("reference must not be blank");
    }
    Objects.requireNonNull(settledAt, "settledAt must not be null");
  }
}
