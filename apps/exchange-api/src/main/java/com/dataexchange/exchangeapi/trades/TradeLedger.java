package com.dataexchange.exchangeapi.trades;

import com.dataexchange.domain.pools.PairKey;
import com.dataexchange.domain.trades.Trade;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only history of executed swaps. List queries return the most recent trades first and
 * clamp {@code limit} to {@code [1, amm.max-page-size]}.
 */
public interface TradeLedger {
  void record(Trade trade);

  List<Trade> recentTrades(int limit);

  List<Trade> tradesForPool(PairKey pairKey, int limit);

  List<Trade> tradesForTrader(String trader, int limit);

  /** Trades where {@code token} was either sold or bought. */
  List<Trade> tradesForToken(String token, int limit);

  Optional<Trade> findByClientTradeId(String trader, String clientTradeId);

  PoolActivity poolActivity(PairKey pairKey, Instant since);

  TraderActivity traderActivity(String trader);
}
