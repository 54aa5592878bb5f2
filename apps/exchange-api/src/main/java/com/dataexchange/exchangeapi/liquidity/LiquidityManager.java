package com.dataexchange.exchangeapi.liquidity;

import com.dataexchange.domain.pools.InsufficientPositionException;
import com.dataexchange.domain.pools.InvalidLiquidityAmountException;
import com.dataexchange.domain.pools.InvariantViolationException;
import com.dataexchange.domain.pools.LiquidityAddQuote;
import com.dataexchange.domain.pools.LiquidityRemoveQuote;
import com.dataexchange.domain.pools.PairKey;
import com.dataexchange.domain.pools.Pool;
import com.dataexchange.domain.pools.PricingEngine;
import com.dataexchange.exchangeapi.config.AmmProperties;
import com.dataexchange.exchangeapi.observability.AmmMetrics;
import com.dataexchange.exchangeapi.pools.PoolStore;
import com.dataexchange.exchangeapi.pools.PoolUpdate;
import com.dataexchange.exchangeapi.settlement.SettlementRequest;
import com.dataexchange.exchangeapi.settlement.SettlementService;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class LiquidityManager {
  private static final Logger log = LoggerFactory.getLogger(LiquidityManager.class);

  static final String ADD = "add";
  static final String REMOVE = "remove";

  private final PoolStore poolStore;
  private final PositionLedger positionLedger;
  private final SettlementService settlementService;
  private final AmmProperties properties;
  private final AmmMetrics metrics;

  public LiquidityManager(
      PoolStore poolStore,
      PositionLedger positionLedger,
      SettlementService settlementService,
      AmmProperties properties,
      AmmMetrics metrics) {
    this.poolStore = poolStore;
    this.positionLedger = positionLedger;
    this.settlementService = settlementService;
    this.properties = properties;
    this.metrics = metrics;
  }

  /**
   * Deposits both tokens, creating the pool on first use. The first deposit fixes the exchange
   * rate; later ones must match it within {@code amm.liquidity-ratio-tolerance}.
   */
  public LiquidityAddResult addLiquidity(
      String tokenA, String tokenB, BigDecimal amountA, BigDecimal amountB, String provider) {
    PairKey pairKey = PairKey.of(tokenA, tokenB);
    PricingEngine.requireAmount(amountA, "amountA");
    PricingEngine.requireAmount(amountB, "amountB");
    String owner = requireProvider(provider);
    String first = tokenA.trim();
    boolean callerOrder = pairKey.isTokenA(first);
    BigDecimal canonicalA = callerOrder ? amountA : amountB;
    BigDecimal canonicalB = callerOrder ? amountB : amountA;

    return track(
        ADD,
        pairKey,
        owner,
        () -> {
          poolStore.createPoolIfAbsent(pairKey);
          return poolStore.withPoolLock(
              pairKey,
              current -> {
                LiquidityAddQuote quote =
                    PricingEngine.quoteLiquidityAdd(
                        current.reserveA(),
                        current.reserveB(),
                        current.totalLiquidityUnits(),
                        canonicalA,
                        canonicalB,
                        properties.getLiquidityRatioTolerance());
                Pool next =
                    current.withState(
                        current.reserveA().add(quote.consumedA()),
                        current.reserveB().add(quote.consumedB()),
                        current.totalLiquidityUnits().add(quote.mintedUnits()),
                        Instant.now());
                SettlementRequest settlement =
                    SettlementRequest.liquidityAdd(
                        owner, pairKey, quote.consumedA(), quote.consumedB());
                BigDecimal providerUnits =
                    positionLedger.credit(pairKey, owner, quote.mintedUnits());

                BigDecimal consumedFirst = callerOrder ? quote.consumedA() : quote.consumedB();
                BigDecimal consumedSecond = callerOrder ? quote.consumedB() : quote.consumedA();
                LiquidityAddResult result =
                    new LiquidityAddResult(
                        pairKey,
                        first,
                        pairKey.counterpart(first),
                        quote.mintedUnits(),
                        consumedFirst,
                        consumedSecond,
                        amountA.subtract(consumedFirst),
                        amountB.subtract(consumedSecond),
                        providerUnits,
                        settlement.reference());
                return new PoolUpdate<>(next, result)
                    .withFinalStep(
                        () -> {
                          settlementService.settle(settlement);
                          log.info(
                              "Liquidity added pairKey={} provider={} minted={} consumedA={}"
                                  + " consumedB={} totalUnits={}",
                              pairKey,
                              owner,
                              quote.mintedUnits(),
                              quote.consumedA(),
                              quote.consumedB(),
                              next.totalLiquidityUnits());
                        });
              });
        });
  }

  /** Burns units and pays out the proportional share of both reserves. */
  public LiquidityRemoveResult removeLiquidity(
      String tokenA, String tokenB, BigDecimal unitsToBurn, String provider) {
    PairKey pairKey = PairKey.of(tokenA, tokenB);
    if (unitsToBurn == null
        || unitsToBurn.signum() <= 0
        || unitsToBurn.stripTrailingZeros().scale() > PricingEngine.SCALE) {
      throw new InvalidLiquidityAmountException(
          "unitsToBurn must be > 0 with at most " + PricingEngine.SCALE + " decimal places");
    }
    String owner = requireProvider(provider);
    String first = tokenA.trim();
    boolean callerOrder = pairKey.isTokenA(first);

    return track(
        REMOVE,
        pairKey,
        owner,
        () ->
            poolStore.withPoolLock(
                pairKey,
                current -> {
                  BigDecimal held = positionLedger.unitsHeld(pairKey, owner);
                  if (held.compareTo(unitsToBurn) < 0) {
                    throw new InsufficientPositionException(owner, pairKey, unitsToBurn, held);
                  }
                  LiquidityRemoveQuote quote =
                      PricingEngine.quoteLiquidityRemove(
                          current.reserveA(),
                          current.reserveB(),
                          current.totalLiquidityUnits(),
                          unitsToBurn);
                  Pool next =
                      current.withState(
                          current.reserveA().subtract(quote.amountA()),
                          current.reserveB().subtract(quote.amountB()),
                          current.totalLiquidityUnits().subtract(unitsToBurn),
                          Instant.now());
                  SettlementRequest settlement =
                      SettlementRequest.liquidityRemove(
                          owner, pairKey, quote.amountA(), quote.amountB());
                  BigDecimal remaining = positionLedger.debit(pairKey, owner, unitsToBurn);

                  LiquidityRemoveResult result =
                      new LiquidityRemoveResult(
                          pairKey,
                          first,
                          pairKey.counterpart(first),
                          callerOrder ? quote.amountA() : quote.amountB(),
                          callerOrder ? quote.amountB() : quote.amountA(),
                          unitsToBurn,
                          remaining,
                          settlement.reference());
                  return new PoolUpdate<>(next, result)
                      .withFinalStep(
                          () -> {
                            settlementService.settle(settlement);
                            log.info(
                                "Liquidity removed pairKey={} provider={} burned={} amountA={}"
                                    + " amountB={} totalUnits={}",
                                pairKey,
                                owner,
                                unitsToBurn,
                                quote.amountA(),
                                quote.amountB(),
                                next.totalLiquidityUnits());
                          });
                }));
  }

  /** Current holdings of a provider, each valued at the pool's present reserves. */
  public List<LiquidityPosition> positionsFor(String provider) {
    String owner = requireProvider(provider);
    return positionLedger.holdingsOf(owner).stream()
        .map(this::value)
        .flatMap(Optional::stream)
        .toList();
  }

  private Optional<LiquidityPosition> value(PositionHolding holding) {
    return poolStore
        .findPool(holding.pairKey())
        .filter(pool -> !pool.isEmpty())
        .map(
            pool -> {
              LiquidityRemoveQuote share =
                  PricingEngine.quoteLiquidityRemove(
                      pool.reserveA(),
                      pool.reserveB(),
                      pool.totalLiquidityUnits(),
                      holding.units().min(pool.totalLiquidityUnits()));
              return new LiquidityPosition(
                  holding.pairKey(),
                  holding.provider(),
                  holding.units(),
                  share.amountA(),
                  share.amountB());
            });
  }

  private <T> T track(String operation, PairKey pairKey, String provider, Supplier<T> action) {
    try {
      T result = action.get();
      metrics.onLiquidity(operation, AmmMetrics.SUCCESS);
      return result;
    } catch (InvariantViolationException ex) {
      log.error(
          "Invariant violation during liquidity {} pairKey={} provider={} before={} after={}",
          operation,
          pairKey,
          provider,
          ex.before(),
          ex.after(),
          ex);
      metrics.onLiquidity(operation, AmmMetrics.outcomeOf(ex));
      throw ex;
    } catch (RuntimeException ex) {
      metrics.onLiquidity(operation, AmmMetrics.outcomeOf(ex));
      throw ex;
    }
  }

  private static String requireProvider(String provider) {
    if (provider == null || provider.isBlank()) {
      throw new IllegalArgumentException("provider must not be blank");
    }
    return provider.trim();
  }
}
