package com.dataexchange.exchangeapi.settlement;

import com.dataexchange.domain.pools.PairKey;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Token movements for one pool operation. The {@code reference} is chosen before settlement so the
 * trade or position change can be written with it first; a settlement backend must treat a repeated
 * reference as the same transfer.
 */
public record SettlementRequest(
    String reference,
    SettlementKind kind,
    String party,
    PairKey pairKey,
    List<SettlementLeg> legs) {

  public SettlementRequest {
    if (reference == null || reference.isBlank()) {
      throw new IllegalArgumentException("reference must not be blank");
    }
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(party, "party must not be null");
    Objects.requireNonNull(pairKey, "pairKey must not be null");
    legs = List.copyOf(legs);
  }

  public static SettlementRequest swap(
      String trader,
      PairKey pairKey,
      String tokenIn,
      BigDecimal amountIn,
      String tokenOut,
      BigDecimal amountOut) {
    return new SettlementRequest(
        newReference(),
        SettlementKind.SWAP,
        trader,
        pairKey,
        List.of(
            new SettlementLeg(tokenIn, amountIn, SettlementLeg.Direction.TO_POOL),
            new SettlementLeg(tokenOut, amountOut, SettlementLeg.Direction.FROM_POOL)));
  }

  public static SettlementRequest liquidityAdd(
      String provider, PairKey pairKey, BigDecimal amountA, BigDecimal amountB) {
    return new SettlementRequest(
        newReference(),
        SettlementKind.LIQUIDITY_ADD,
        provider,
        pairKey,
        List.of(
            new SettlementLeg(pairKey.tokenA(), amountA, SettlementLeg.Direction.TO_POOL),
            new SettlementLeg(pairKey.tokenB(), amountB, SettlementLeg.Direction.TO_POOL)));
  }

  public static SettlementRequest liquidityRemove(
      String provider, PairKey pairKey, BigDecimal amountA, BigDecimal amountB) {
    return new SettlementRequest(
        newReference(),
        SettlementKind.LIQUIDITY_REMOVE,
        provider,
        pairKey,
        List.of(
            new SettlementLeg(pairKey.tokenA(), amountA, SettlementLeg.Direction.FROM_POOL),
            new SettlementLeg(pairKey.tokenB(), amountB, SettlementLeg.Direction.FROM_POOL)));
  }

  private static String newReference() {
    return "stl-" + UUID.randomUUID();
  }
}
