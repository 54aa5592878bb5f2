package com.dataexchange.exchangeapi.liquidity;

import com.dataexchange.domain.pools.PairKey;
import java.math.BigDecimal;
import java.time.Instant;

public record PositionHolding(
    PairKey pairKey, String provider, BigDecimal units, Instant updatedAt) {}
