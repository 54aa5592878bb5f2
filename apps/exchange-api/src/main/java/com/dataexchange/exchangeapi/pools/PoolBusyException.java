package com.dataexchange.exchangeapi.pools;

import com.dataexchange.domain.pools.PairKey;
import java.time.Duration;

/** The pool lock was not granted in time. Nothing was changed; the caller may retry. */
public class PoolBusyException extends RuntimeException {
  private final PairKey pairKey;

  public PoolBusyException(PairKey pairKey, Duration waited, Throwable cause) {
    super("Pool " + pairKey + " is busy, lock not acquired within " + waited.toMillis() + "ms", cause);
    this.pairKey = pairKey;
  }

  public PairKey pairKey() {
    return pairKey;
  }
}
