package com.dataexchange.exchangeapi.pools;

import com.dataexchange.domain.pools.PairKey;
import com.dataexchange.domain.pools.Pool;
import java.util.List;
import java.util.Optional;

/**
 * Durable home of pool state. Reads are lock-free snapshots; every mutation goes through {@link
 * #withPoolLock}, which serializes writers per pool.
 */
public interface PoolStore {
  /**
   * @throws com.dataexchange.domain.pools.PoolNotFoundException when the pair has never existed
   */
  Pool getPool(PairKey pairKey);

  Optional<Pool> findPool(PairKey pairKey);

  List<Pool> listPools();

  /** Returns the existing pool, or a freshly created empty one. Safe to race. */
  Pool createPoolIfAbsent(PairKey pairKey);

  /**
   * Runs {@code mutation} with exclusive access to the pool, persists the pool it returns, then
   * runs the update's final step, all before the lock is released. Anything the mutation or the
   * final step throws leaves the stored pool untouched.
   *
   * @throws com.dataexchange.domain.pools.PoolNotFoundException when the pair has never existed
   * @throws PoolBusyException when the lock cannot be acquired within the configured timeout
   */
  <T> T withPoolLock(PairKey pairKey, PoolMutation<T> mutation);
}
