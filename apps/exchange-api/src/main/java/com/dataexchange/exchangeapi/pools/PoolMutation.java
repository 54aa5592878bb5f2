package com.dataexchange.exchangeapi.pools;

import com.dataexchange.domain.pools.Pool;

@FunctionalInterface
public interface PoolMutation<T> {
  PoolUpdate<T> apply(Pool current);
}
