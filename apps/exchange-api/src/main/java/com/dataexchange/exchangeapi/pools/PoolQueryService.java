package com.dataexchange.exchangeapi.pools;

import com.dataexchange.domain.pools.PairKey;
import com.dataexchange.exchangeapi.trades.PoolActivity;
import com.dataexchange.exchangeapi.trades.TradeLedger;
import java.time.Instant;
import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PoolQueryService {
  private final PoolStore poolStore;
  private final TradeLedger tradeLedger;

  public PoolQueryService(PoolStore poolStore, TradeLedger tradeLedger) {
    this.poolStore = poolStore;
    this.tradeLedger = tradeLedger;
  }

  @Transactional(readOnly = true)
  public List<PoolView> listPools() {
    return poolStore.listPools().stream().map(PoolView::canonical).toList();
  }

  @Transactional(readOnly = true)
  public PoolView poolInfo(String tokenA, String tokenB) {
    PairKey pairKey = PairKey.of(tokenA, tokenB);
    return PoolView.of(poolStore.getPool(pairKey), tokenA);
  }

  @Transactional(readOnly = true)
  public PoolActivity poolActivity(String tokenA, String tokenB, Instant since) {
    PairKey pairKey = PairKey.of(tokenA, tokenB);
    poolStore.getPool(pairKey);
    if (since.isAfter(Instant.now())) {
      throw new IllegalArgumentException("since must not be in the future");
    }
    return tradeLedger.poolActivity(pairKey, since);
  }
}
