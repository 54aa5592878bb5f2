package com.dataexchange.exchangeapi.trades;

import com.dataexchange.domain.pools.PairKey;
import com.dataexchange.domain.pools.PricingEngine;
import com.dataexchange.domain.trades.Trade;
import com.dataexchange.exchangeapi.config.AmmProperties;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcTradeLedger implements TradeLedger {
  private static final String TRADE_COLUMNS =
      """
      id, pair_key, token_in, token_out, amount_in, amount_out, fee_amount, effective_price,
      trader, settlement_reference, client_trade_id, executed_at
      """;
  private static final String MOST_RECENT_FIRST = " ORDER BY executed_at DESC, seq DESC LIMIT ?";

  private final JdbcTemplate jdbcTemplate;
  private final AmmProperties properties;

  public JdbcTradeLedger(JdbcTemplate jdbcTemplate, AmmProperties properties) {
    this.jdbcTemplate = jdbcTemplate;
    this.properties = properties;
  }

  @Override
  public void record(Trade trade) {
    String sql =
        """
        INSERT INTO trades (id, pair_key, token_in, token_out, amount_in, amount_out, fee_amount,
                            effective_price, trader, settlement_reference, client_trade_id,
                            executed_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
    jdbcTemplate.update(
        sql,
        trade.id(),
        trade.pairKey().value(),
        trade.tokenIn(),
        trade.tokenOut(),
        trade.amountIn(),
        trade.amountOut(),
        trade.feeAmount(),
        trade.effectivePrice(),
        trade.trader(),
        trade.settlementReference(),
        trade.clientTradeId(),
        Timestamp.from(trade.executedAt()));
  }

  @Override
  public List<Trade> recentTrades(int limit) {
    String sql = "SELECT " + TRADE_COLUMNS + " FROM trades" + MOST_RECENT_FIRST;
    return jdbcTemplate.query(sql, this::mapRow, properties.clampLimit(limit));
  }

  @Override
  public List<Trade> tradesForPool(PairKey pairKey, int limit) {
    String sql = "SELECT " + TRADE_COLUMNS + " FROM trades WHERE pair_key = ?" + MOST_RECENT_FIRST;
    return jdbcTemplate.query(sql, this::mapRow, pairKey.value(), properties.clampLimit(limit));
  }

  @Override
  public List<Trade> tradesForTrader(String trader, int limit) {
    String sql = "SELECT " + TRADE_COLUMNS + " FROM trades WHERE trader = ?" + MOST_RECENT_FIRST;
    return jdbcTemplate.query(sql, this::mapRow, trader, properties.clampLimit(limit));
  }

  @Override
  public List<Trade> tradesForToken(String token, int limit) {
    String sql =
        "SELECT "
            + TRADE_COLUMNS
            + " FROM trades WHERE token_in = ? OR token_out = ?"
            + MOST_RECENT_FIRST;
    return jdbcTemplate.query(sql, this::mapRow, token, token, properties.clampLimit(limit));
  }

  @Override
  public Optional<Trade> findByClientTradeId(String trader, String clientTradeId) {
    String sql =
        "SELECT " + TRADE_COLUMNS + " FROM trades WHERE trader = ? AND client_trade_id = ?";
    List<Trade> rows = jdbcTemplate.query(sql, this::mapRow, trader, clientTradeId);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public PoolActivity poolActivity(PairKey pairKey, Instant since) {
    String tokenA = pairKey.tokenA();
    String sql =
        """
        SELECT COUNT(*) AS trade_count,
               COALESCE(SUM(CASE WHEN token_in = ? THEN amount_in ELSE amount_out END), 0) AS volume_a,
               COALESCE(SUM(CASE WHEN token_in = ? THEN amount_out ELSE amount_in END), 0) AS volume_b,
               COALESCE(SUM(CASE WHEN token_in = ? THEN fee_amount ELSE 0 END), 0) AS fees_a,
               COALESCE(SUM(CASE WHEN token_in = ? THEN 0 ELSE fee_amount END), 0) AS fees_b
        FROM trades
        WHERE pair_key = ? AND executed_at >= ?
        """;
    Timestamp sinceTs = Timestamp.from(since);
    Aggregate aggregate =
        jdbcTemplate.queryForObject(
            sql,
            (rs, rowNum) ->
                new Aggregate(
                    rs.getLong("trade_count"),
                    rs.getBigDecimal("volume_a"),
                    rs.getBigDecimal("volume_b"),
                    rs.getBigDecimal("fees_a"),
                    rs.getBigDecimal("fees_b")),
            tokenA,
            tokenA,
            tokenA,
            tokenA,
            pairKey.value(),
            sinceTs);

    String lastSql =
        "SELECT "
            + TRADE_COLUMNS
            + " FROM trades WHERE pair_key = ? AND executed_at >= ?"
            + MOST_RECENT_FIRST;
    List<Trade> last = jdbcTemplate.query(lastSql, this::mapRow, pairKey.value(), sinceTs, 1);
    Trade lastTrade = last.isEmpty() ? null : last.get(0);

    return new PoolActivity(
        pairKey,
        since,
        aggregate.tradeCount(),
        aggregate.volumeA(),
        aggregate.volumeB(),
        aggregate.feesA(),
        aggregate.feesB(),
        lastTrade != null ? priceOfTokenA(lastTrade) : null,
        lastTrade != null ? lastTrade.executedAt() : null);
  }

  @Override
  public TraderActivity traderActivity(String trader) {
    String sql =
        """
        SELECT COUNT(*) AS trade_count, MIN(executed_at) AS first_trade_at,
               MAX(executed_at) AS last_trade_at
        FROM trades
        WHERE trader = ?
        """;
    String volumeSql =
        """
        SELECT token_in, SUM(amount_in) AS volume
        FROM trades
        WHERE trader = ?
        GROUP BY token_in
        ORDER BY token_in
        """;
    Map<String, BigDecimal> volumeByToken = new LinkedHashMap<>();
    jdbcTemplate.query(
        volumeSql,
        rs -> {
          volumeByToken.put(rs.getString("token_in"), rs.getBigDecimal("volume"));
        },
        trader);
    return jdbcTemplate.queryForObject(
        sql,
        (rs, rowNum) -> {
          Timestamp first = rs.getTimestamp("first_trade_at");
          Timestamp lastAt = rs.getTimestamp("last_trade_at");
          return new TraderActivity(
              trader,
              rs.getLong("trade_count"),
              volumeByToken,
              first != null ? first.toInstant() : null,
              lastAt != null ? lastAt.toInstant() : null);
        },
        trader);
  }

  static BigDecimal priceOfTokenA(Trade trade) {
    if (trade.tokenIn().equals(trade.pairKey().tokenA())) {
      return trade.effectivePrice();
    }
    return PricingEngine.price(trade.amountIn(), trade.amountOut());
  }

  private Trade mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Trade(
        rs.getObject("id", UUID.class),
        PairKey.parse(rs.getString("pair_key")),
        rs.getString("token_in"),
        rs.getString("token_out"),
        rs.getBigDecimal("amount_in"),
        rs.getBigDecimal("amount_out"),
        rs.getBigDecimal("fee_amount"),
        rs.getBigDecimal("effective_price"),
        rs.getString("trader"),
        rs.getString("settlement_reference"),
        rs.getString("client_trade_id"),
        rs.getTimestamp("executed_at").toInstant());
  }

  private record Aggregate(
      long tradeCount,
      BigDecimal volumeA,
      BigDecimal volumeB,
      BigDecimal feesA,
      BigDecimal feesB) {}
}
