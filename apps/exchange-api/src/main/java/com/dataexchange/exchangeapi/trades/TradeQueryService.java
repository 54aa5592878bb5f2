package com.dataexchange.exchangeapi.trades;

import com.dataexchange.domain.pools.PairKey;
import com.dataexchange.domain.trades.Trade;
import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TradeQueryService {
  private final TradeLedger tradeLedger;

  public TradeQueryService(TradeLedger tradeLedger) {
    this.tradeLedger = tradeLedger;
  }

  @Transactional(readOnly = true)
  public List<Trade> recentTrades(int limit) {
    return tradeLedger.recentTrades(limit);
  }

  /** Exactly one of {@code pool} ({@code tokenA:tokenB}), {@code trader} or {@code token}. */
  @Transactional(readOnly = true)
  public List<Trade> findTrades(String pool, String trader, String token, int limit) {
    int filters = count(pool) + count(trader) + count(token);
    if (filters != 1) {
      throw new IllegalArgumentException("Exactly one of pool, trader or token must be given");
    }
    if (!isBlank(pool)) {
      return tradeLedger.tradesForPool(PairKey.parse(pool), limit);
    }
    if (!isBlank(trader)) {
      return tradeLedger.tradesForTrader(trader.trim(), limit);
    }
    return tradeLedger.tradesForToken(token.trim(), limit);
  }

  @Transactional(readOnly = true)
  public TraderActivity traderActivity(String trader) {
    if (isBlank(trader)) {
      throw new IllegalArgumentException("trader must not be blank");
    }
    return tradeLedger.traderActivity(trader.trim());
  }

  private static int count(String value) {
    return isBlank(value) ? 0 : 1;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
