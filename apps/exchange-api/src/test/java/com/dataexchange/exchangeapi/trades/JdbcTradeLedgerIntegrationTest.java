package com.dataexchange.exchangeapi.trades;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dataexchange.domain.pools.PairKey;
import com.dataexchange.domain.trades.Trade;
import com.dataexchange.exchangeapi.config.AmmProperties;
import com.dataexchange.exchangeapi.pools.JdbcPoolStore;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class JdbcTradeLedgerIntegrationTest {
  private static final PairKey DATA_USDC = PairKey.of("DATA", "USDC");
  private static final PairKey DATA_WETH = PairKey.of("DATA", "WETH");
  private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

  @Container
  static final PostgreSQLContainer<?> POSTGRES =
      new PostgreSQLContainer<>("postgres:16")
          .withDatabaseName("exchange")
          .withUsername("exchange")
          .withPassword("exchange");

  private JdbcTemplate jdbcTemplate;
  private JdbcTradeLedger ledger;

  @BeforeEach
  void setUp() {
    DriverManagerDataSource dataSource = new DriverManagerDataSource();
    dataSource.setDriverClassName(POSTGRES.getDriverClassName());
    dataSource.setUrl(POSTGRES.getJdbcUrl());
    dataSource.setUsername(POSTGRES.getUsername());
    dataSource.setPassword(POSTGRES.getPassword());

    Flyway flyway =
        Flyway.configure()
            .dataSource(dataSource)
            .locations("classpath:db/migration")
            .cleanDisabled(false)
            .load();
    flyway.clean();
    flyway.migrate();

    jdbcTemplate = new JdbcTemplate(dataSource);
    AmmProperties properties = new AmmProperties();
    JdbcPoolStore poolStore =
        new JdbcPoolStore(jdbcTemplate, new DataSourceTransactionManager(dataSource), properties);
    poolStore.createPoolIfAbsent(DATA_USDC);
    poolStore.createPoolIfAbsent(DATA_WETH);
    ledger = new JdbcTradeLedger(jdbcTemplate, properties);
  }

  @Test
  void recentTradesAreNewestFirstAndLimitIsClamped() {
    Trade first = trade(DATA_USDC, "DATA", "alice", null, T0);
    Trade second = trade(DATA_USDC, "USDC", "bob", null, T0.plusSeconds(1));
    Trade third = trade(DATA_WETH, "WETH", "alice", null, T0.plusSeconds(2));
    ledger.record(first);
    ledger.record(second);
    ledger.record(third);

    List<Trade> recent = ledger.recentTrades(2);
    assertEquals(2, recent.size());
    assertEquals(third.id(), recent.get(0).id());
    assertEquals(second.id(), recent.get(1).id());
    assertEquals(1, ledger.recentTrades(0).size());
    assertEquals(3, ledger.recentTrades(1_000).size());
  }

  @Test
  void tradesAreFilteredByPoolTraderAndToken() {
    ledger.record(trade(DATA_USDC, "DATA", "alice", null, T0));
    ledger.record(trade(DATA_USDC, "USDC", "bob", null, T0.plusSeconds(1)));
    ledger.record(trade(DATA_WETH, "WETH", "alice", null, T0.plusSeconds(2)));

    assertEquals(2, ledger.tradesForPool(DATA_USDC, 10).size());
    assertEquals(2, ledger.tradesForTrader("alice", 10).size());
    assertEquals(3, ledger.tradesForToken("DATA", 10).size());
    assertEquals(2, ledger.tradesForToken("USDC", 10).size());
    assertEquals(1, ledger.tradesForToken("WETH", 10).size());
  }

  @Test
  void storedTradeIsReadBackUnchanged() {
    Trade stored = trade(DATA_USDC, "DATA", "alice", "c-1", T0);
    ledger.record(stored);

    Trade loaded = ledger.findByClientTradeId("alice", "c-1").orElseThrow();
    assertEquals(stored.id(), loaded.id());
    assertEquals(DATA_USDC, loaded.pairKey());
    assertEquals("USDC", loaded.tokenOut());
    assertEquals(0, stored.amountOut().compareTo(loaded.amountOut()));
    assertEquals(stored.executedAt(), loaded.executedAt());
    assertTrue(ledger.findByClientTradeId("bob", "c-1").isEmpty());
  }

  @Test
  void clientTradeIdIsUniquePerTrader() {
    ledger.record(trade(DATA_USDC, "DATA", "alice", "c-1", T0));

    assertThrows(
        DuplicateKeyException.class,
        () -> ledger.record(trade(DATA_USDC, "DATA", "alice", "c-1", T0.plusSeconds(1))));
    ledger.record(trade(DATA_USDC, "DATA", "bob", "c-1", T0.plusSeconds(2)));
  }

  @Test
  void tradesCannotBeUpdatedOrDeleted() {
    ledger.record(trade(DATA_USDC, "DATA", "alice", null, T0));

    assertThrows(
        DataAccessException.class,
        () -> jdbcTemplate.update("UPDATE trades SET trader = 'mallory'"));
    assertThrows(DataAccessException.class, () -> jdbcTemplate.update("DELETE FROM trades"));
    assertEquals(1, ledger.recentTrades(10).size());
  }

  @Test
  void poolActivityAggregatesBothDirections() {
    ledger.record(trade(DATA_USDC, "DATA", "alice", null, T0.minusSeconds(3600)));
    ledger.record(trade(DATA_USDC, "DATA", "alice", null, T0));
    ledger.record(trade(DATA_USDC, "USDC", "bob", null, T0.plusSeconds(1)));

    PoolActivity activity = ledger.poolActivity(DATA_USDC, T0);

    assertEquals(2, activity.tradeCount());
    // DATA sold: 10 in; DATA bought: 20 out
    assertEquals(0, new BigDecimal("30").compareTo(activity.volumeA()));
    assertEquals(0, new BigDecimal("30").compareTo(activity.volumeB()));
    assertEquals(0, new BigDecimal("0.03").compareTo(activity.feesA()));
    assertEquals(0, new BigDecimal("0.03").compareTo(activity.feesB()));
    assertEquals(0, new BigDecimal("0.5").compareTo(activity.lastPrice()));
    assertEquals(T0.plusSeconds(1), activity.lastTradeAt());
  }

  @Test
  void poolActivityOfQuietWindowIsEmpty() {
    PoolActivity activity = ledger.poolActivity(DATA_WETH, T0);

    assertEquals(0, activity.tradeCount());
    assertEquals(0, BigDecimal.ZERO.compareTo(activity.volumeA()));
    assertNull(activity.lastPrice());
    assertNull(activity.lastTradeAt());
  }

  @Test
  void traderActivitySpansFirstAndLastTrade() {
    ledger.record(trade(DATA_USDC, "DATA", "alice", null, T0));
    ledger.record(trade(DATA_WETH, "DATA", "alice", null, T0.plusSeconds(60)));
    ledger.record(trade(DATA_USDC, "USDC", "alice", null, T0.plusSeconds(30)));

    TraderActivity activity = ledger.traderActivity("alice");
    assertEquals(3, activity.tradeCount());
    assertEquals(List.of("DATA", "USDC"), List.copyOf(activity.volumeByToken().keySet()));
    assertEquals(0, new BigDecimal("20").compareTo(activity.volumeByToken().get("DATA")));
    assertEquals(0, new BigDecimal("10").compareTo(activity.volumeByToken().get("USDC")));
    assertEquals(T0, activity.firstTradeAt());
    assertEquals(T0.plusSeconds(60), activity.lastTradeAt());

    TraderActivity none = ledger.traderActivity("nobody");
    assertEquals(0, none.tradeCount());
    assertTrue(none.volumeByToken().isEmpty());
    assertNull(none.firstTradeAt());
  }

  @Test
  void tinyEffectivePriceIsStoredExactly() {
    PairKey dataWei = PairKey.of("DATA", "WEI");
    BigDecimal tinyPrice = new BigDecimal("9.96006981039903E-22");
    Trade tiny =
        new Trade(
            UUID.randomUUID(),
            dataWei,
            "DATA",
            "WEI",
            new BigDecimal("1000000000000000000"),
            new BigDecimal("0.000996006981039903"),
            new BigDecimal("3000000000000000"),
            tinyPrice,
            "whale",
            "stl-" + UUID.randomUUID(),
            null,
            T0);
    jdbcTemplate.update(
        "INSERT INTO liquidity_pools (pair_key, token_a, token_b) VALUES (?, ?, ?)",
        dataWei.value(),
        dataWei.tokenA(),
        dataWei.tokenB());

    ledger.record(tiny);

    Trade loaded = ledger.tradesForTrader("whale", 1).get(0);
    assertEquals(0, tinyPrice.compareTo(loaded.effectivePrice()));
  }

  /** Sells 10 of {@code tokenIn} for 20 of the counterpart with a 0.03 fee. */
  private static Trade trade(
      PairKey pairKey, String tokenIn, String trader, String clientTradeId, Instant executedAt) {
    return new Trade(
        UUID.randomUUID(),
        pairKey,
        tokenIn,
        pairKey.counterpart(tokenIn),
        new BigDecimal("10"),
        new BigDecimal("20"),
        new BigDecimal("0.03"),
        new BigDecimal("2"),
        trader,
        "stl-" + UUID.randomUUID(),
        clientTradeId,
        executedAt);
  }
}
