package com.dataexchange.exchangeapi.swaps;

import com.dataexchange.domain.pools.InsufficientAmountException;
import com.dataexchange.domain.pools.InvariantViolationException;
import com.dataexchange.domain.pools.PairKey;
import com.dataexchange.domain.pools.Pool;
import com.dataexchange.domain.pools.PricingEngine;
import com.dataexchange.domain.pools.SlippageExceededException;
import com.dataexchange.domain.pools.SwapQuote;
import com.dataexchange.domain.trades.Trade;
import com.dataexchange.exchangeapi.config.AmmProperties;
import com.dataexchange.exchangeapi.observability.AmmMetrics;
import com.dataexchange.exchangeapi.pools.PoolStore;
import com.dataexchange.exchangeapi.pools.PoolUpdate;
import com.dataexchange.exchangeapi.settlement.SettlementRequest;
import com.dataexchange.exchangeapi.settlement.SettlementService;
import com.dataexchange.exchangeapi.trades.TradeLedger;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SwapExecutor {
  private static final Logger log = LoggerFactory.getLogger(SwapExecutor.class);

  private final PoolStore poolStore;
  private final TradeLedger tradeLedger;
  private final SettlementService settlementService;
  private final AmmProperties properties;
  private final AmmMetrics metrics;

  public SwapExecutor(
      PoolStore poolStore,
      TradeLedger tradeLedger,
      SettlementService settlementService,
      AmmProperties properties,
      AmmMetrics metrics) {
    this.poolStore = poolStore;
    this.tradeLedger = tradeLedger;
    this.settlementService = settlementService;
    this.properties = properties;
    this.metrics = metrics;
  }

  /** Prices a swap against the current reserves. Takes no lock and changes nothing. */
  public QuoteResult getQuote(String tokenIn, String tokenOut, BigDecimal amountIn) {
    PairKey pairKey = PairKey.of(tokenIn, tokenOut);
    PricingEngine.requireAmount(amountIn, "amountIn");
    String in = tokenIn.trim();
    String out = pairKey.counterpart(in);

    Pool pool = poolStore.getPool(pairKey);
    BigDecimal reserveIn = pool.reserveOf(in);
    BigDecimal reserveOut = pool.reserveOf(out);
    SwapQuote quote =
        PricingEngine.quoteSwap(reserveIn, reserveOut, amountIn, properties.getFeeRateBps());
    return new QuoteResult(
        pairKey,
        in,
        out,
        amountIn,
        quote.amountOut(),
        quote.feeAmount(),
        quote.priceImpactPct(),
        quote.spotPrice(),
        quote.executionPrice(),
        reserveIn,
        reserveOut);
  }

  public Trade executeSwap(ExecuteSwapCommand command) {
    PairKey pairKey = PairKey.of(command.tokenIn(), command.tokenOut());
    PricingEngine.requireAmount(command.amountIn(), "amountIn");
    if (command.minAmountOut() == null || command.minAmountOut().signum() < 0) {
      throw new InsufficientAmountException("minAmountOut must be >= 0");
    }
    if (command.trader() == null || command.trader().isBlank()) {
      throw new IllegalArgumentException("trader must not be blank");
    }
    String tokenIn = command.tokenIn().trim();
    String trader = command.trader().trim();
    String clientTradeId =
        command.clientTradeId() == null || command.clientTradeId().isBlank()
            ? null
            : command.clientTradeId().trim();

    long startedAt = System.nanoTime();
    try {
      Trade trade =
          poolStore.withPoolLock(
              pairKey, current -> swap(current, tokenIn, command, trader, clientTradeId));
      metrics.onSwap(AmmMetrics.SUCCESS, System.nanoTime() - startedAt);
      return trade;
    } catch (SlippageExceededException ex) {
      log.warn(
          "Swap rejected for slippage pairKey={} trader={} amountIn={} minAmountOut={} actual={}",
          pairKey,
          trader,
          command.amountIn(),
          ex.minAmountOut(),
          ex.actualAmountOut());
      metrics.onSwap(AmmMetrics.outcomeOf(ex), System.nanoTime() - startedAt);
      throw ex;
    } catch (InvariantViolationException ex) {
      log.error(
          "Invariant violation during swap pairKey={} trader={} before={} after={}",
          pairKey,
          trader,
          ex.before(),
          ex.after(),
          ex);
      metrics.onSwap(AmmMetrics.outcomeOf(ex), System.nanoTime() - startedAt);
      throw ex;
    } catch (RuntimeException ex) {
      metrics.onSwap(AmmMetrics.outcomeOf(ex), System.nanoTime() - startedAt);
      throw ex;
    }
  }

  private PoolUpdate<Trade> swap(
      Pool current,
      String tokenIn,
      ExecuteSwapCommand command,
      String trader,
      String clientTradeId) {
    PairKey pairKey = current.pairKey();
    if (clientTradeId != null) {
      Optional<Trade> existing = tradeLedger.findByClientTradeId(trader, clientTradeId);
      if (existing.isPresent()) {
        requireSameSwap(existing.get(), pairKey, tokenIn, command.amountIn());
        log.info(
            "Swap replayed tradeId={} clientTradeId={} trader={}",
            existing.get().id(),
            clientTradeId,
            trader);
        return PoolUpdate.unchanged(current, existing.get());
      }
    }

    boolean inIsA = pairKey.isTokenA(tokenIn);
    BigDecimal reserveIn = inIsA ? current.reserveA() : current.reserveB();
    BigDecimal reserveOut = inIsA ? current.reserveB() : current.reserveA();
    SwapQuote quote =
        PricingEngine.quoteSwap(
            reserveIn, reserveOut, command.amountIn(), properties.getFeeRateBps());
    if (quote.amountOut().compareTo(command.minAmountOut()) < 0) {
      throw new SlippageExceededException(command.minAmountOut(), quote.amountOut());
    }

    BigDecimal nextIn = reserveIn.add(quote.amountIn());
    BigDecimal nextOut = reserveOut.subtract(quote.amountOut());
    Instant now = Instant.now();
    Pool next =
        inIsA
            ? current.withState(nextIn, nextOut, current.totalLiquidityUnits(), now)
            : current.withState(nextOut, nextIn, current.totalLiquidityUnits(), now);
    PricingEngine.checkProductInvariant(current, next);

    String tokenOut = pairKey.counterpart(tokenIn);
    SettlementRequest settlement =
        SettlementRequest.swap(
            trader, pairKey, tokenIn, quote.amountIn(), tokenOut, quote.amountOut());
    Trade trade =
        Trade.executed(
            UUID.randomUUID(),
            pairKey,
            tokenIn,
            quote,
            trader,
            settlement.reference(),
            clientTradeId,
            now);
    tradeLedger.record(trade);

    return new PoolUpdate<>(next, trade)
        .withFinalStep(
            () -> {
              settlementService.settle(settlement);
              log.info(
                  "Swap executed tradeId={} pairKey={} trader={} {} {} -> {} {} fee={}",
                  trade.id(),
                  pairKey,
                  trader,
                  trade.amountIn(),
                  tokenIn,
                  trade.amountOut(),
                  tokenOut,
                  trade.feeAmount());
            });
  }

  private static void requireSameSwap(
      Trade existing, PairKey pairKey, String tokenIn, BigDecimal amountIn) {
    if (!existing.pairKey().equals(pairKey)
        || !existing.tokenIn().equals(tokenIn)
        || existing.amountIn().compareTo(amountIn) != 0) {
      throw new IllegalArgumentException(
          "clientTradeId " + existing.clientTradeId() + " was already used for a different swap");
    }
  }
}
