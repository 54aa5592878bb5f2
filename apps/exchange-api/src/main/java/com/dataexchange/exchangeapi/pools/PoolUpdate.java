package com.dataexchange.exchangeapi.pools;

import com.dataexchange.domain.pools.Pool;
import java.util.Objects;

/**
 * Next pool state plus the value handed back to the caller of the mutation. An optional {@code
 * finalStep} runs after the pool has been written and before the lock is released; it is the place
 * for side effects that must not happen unless every write before it succeeded.
 */
public record PoolUpdate<T>(Pool pool, T result, Runnable finalStep) {
  public PoolUpdate {
    Objects.requireNonNull(pool, "pool must not be null");
  }

  public PoolUpdate(Pool pool, T result) {
    this(pool, result, null);
  }

  public static <T> PoolUpdate<T> unchanged(Pool current, T result) {
    return new PoolUpdate<>(current, result);
  }

  public PoolUpdate<T> withFinalStep(Runnable step) {
    return new PoolUpdate<>(pool, result, Objects.requireNonNull(step, "step must not be null"));
  }

  void runFinalStep() {
    if (finalStep != null) {
      finalStep.run();
    }
  }
}
