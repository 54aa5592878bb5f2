package com.dataexchange.exchangeapi.observability;

import com.dataexchange.domain.pools.AmmDomainException;
import com.dataexchange.domain.pools.InvariantViolationException;
import com.dataexchange.domain.pools.SlippageExceededException;
import com.dataexchange.exchangeapi.pools.PoolBusyException;
import com.dataexchange.exchangeapi.settlement.SettlementException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Component;

@Component
public class AmmMetrics {
  public static final String SUCCESS = "success";

  private final MeterRegistry meterRegistry;

  public AmmMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void onSwap(String outcome, long durationNanos) {
    Counter.builder("amm.swap.total")
        .description("Swap attempts by outcome")
        .tag("outcome", outcome)
        .register(meterRegistry)
        .increment();

    Timer.builder("amm.swap.duration")
        .description("Swap latency including lock wait")
        .tag("outcome", outcome)
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  public void onLiquidity(String operation, String outcome) {
    Counter.builder("amm.liquidity.total")
        .description("Liquidity changes by operation and outcome")
        .tag("operation", operation)
        .tag("outcome", outcome)
        .register(meterRegistry)
        .increment();
  }

  public static String outcomeOf(Throwable error) {
    if (error instanceof SlippageExceededException) {
      return "slippage";
    }
    if (error instanceof PoolBusyException) {
      return "busy";
    }
    if (error instanceof SettlementException) {
      return "settlement_failed";
    }
    if (error instanceof InvariantViolationException) {
      return "invariant_violation";
    }
    if (error instanceof AmmDomainException) {
      return "rejected";
    }
    return "error";
  }
}
