package com.dataexchange.exchangeapi.pools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dataexchange.domain.pools.PairKey;
import com.dataexchange.domain.pools.Pool;
import com.dataexchange.domain.pools.PoolNotFoundException;
import com.dataexchange.domain.pools.PricingEngine;
import com.dataexchange.domain.pools.SwapQuote;
import com.dataexchange.exchangeapi.config.AmmProperties;
import com.dataexchange.exchangeapi.liquidity.JdbcPositionLedger;
import com.dataexchange.exchangeapi.liquidity.LiquidityManager;
import com.dataexchange.exchangeapi.observability.AmmMetrics;
import com.dataexchange.exchangeapi.settlement.LoggingSettlementService;
import com.dataexchange.exchangeapi.settlement.SettlementException;
import com.dataexchange.exchangeapi.settlement.SettlementService;
import com.dataexchange.exchangeapi.swaps.ExecuteSwapCommand;
import com.dataexchange.exchangeapi.swaps.SwapExecutor;
import com.dataexchange.exchangeapi.trades.JdbcTradeLedger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class JdbcPoolStoreIntegrationTest {
  private static final PairKey KEY = PairKey.of("DATA", "USDC");

  @Container
  static final PostgreSQLContainer<?> POSTGRES =
      new PostgreSQLContainer<>("postgres:16")
          .withDatabaseName("exchange")
          .withUsername("exchange")
          .withPassword("exchange");

  private JdbcTemplate jdbcTemplate;
  private AmmProperties properties;
  private JdbcPoolStore poolStore;
  private JdbcPositionLedger positionLedger;
  private JdbcTradeLedger tradeLedger;
  private AmmMetrics metrics;

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
    properties = new AmmProperties();
    properties.setPoolLockTimeout(Duration.ofMillis(300));
    poolStore =
        new JdbcPoolStore(jdbcTemplate, new DataSourceTransactionManager(dataSource), properties);
    positionLedger = new JdbcPositionLedger(jdbcTemplate);
    tradeLedger = new JdbcTradeLedger(jdbcTemplate, properties);
    metrics = new AmmMetrics(new SimpleMeterRegistry());
  }

  @Test
  void createPoolIfAbsentIsIdempotent() {
    Pool first = poolStore.createPoolIfAbsent(KEY);
    Pool second = poolStore.createPoolIfAbsent(KEY);

    assertTrue(first.isEmpty());
    assertEquals(first.createdAt(), second.createdAt());
    assertEquals(1, poolStore.listPools().size());
    assertTrue(poolStore.findPool(PairKey.of("DATA", "WETH")).isEmpty());
  }

  @Test
  void mutationResultIsPersisted() {
    poolStore.createPoolIfAbsent(KEY);

    String result =
        poolStore.withPoolLock(
            KEY,
            current ->
                new PoolUpdate<>(
                    current.withState(
                        new BigDecimal("10"),
                        new BigDecimal("40"),
                        new BigDecimal("20"),
                        Instant.now()),
                    "done"));

    assertEquals("done", result);
    Pool stored = poolStore.getPool(KEY);
    assertEquals(0, new BigDecimal("10").compareTo(stored.reserveA()));
    assertEquals(0, new BigDecimal("40").compareTo(stored.reserveB()));
    assertEquals(0, new BigDecimal("20").compareTo(stored.totalLiquidityUnits()));
  }

  @Test
  void failedMutationRollsBackEveryWriteInTheLock() {
    poolStore.createPoolIfAbsent(KEY);

    assertThrows(
        IllegalStateException.class,
        () ->
            poolStore.withPoolLock(
                KEY,
                current -> {
                  positionLedger.credit(KEY, "lp1", new BigDecimal("5"));
                  throw new IllegalStateException("boom");
                }));

    assertTrue(poolStore.getPool(KEY).isEmpty());
    assertEquals(0, BigDecimal.ZERO.compareTo(positionLedger.unitsHeld(KEY, "lp1")));
  }

  @Test
  void lockingUnknownPoolFailsWithPoolNotFound() {
    assertThrows(
        PoolNotFoundException.class,
        () -> poolStore.withPoolLock(KEY, current -> PoolUpdate.unchanged(current, null)));
  }

  @Test
  void lockWaitBeyondTimeoutSurfacesAsPoolBusy() throws Exception {
    poolStore.createPoolIfAbsent(KEY);
    CountDownLatch locked = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    ExecutorService holder = Executors.newSingleThreadExecutor();
    try {
      Future<?> held =
          holder.submit(
              () ->
                  poolStore.<Void>withPoolLock(
                      KEY,
                      current -> {
                        locked.countDown();
                        awaitQuietly(release);
                        return PoolUpdate.unchanged(current, null);
                      }));
      assertTrue(locked.await(10, TimeUnit.SECONDS));

      assertThrows(
          PoolBusyException.class,
          () -> poolStore.withPoolLock(KEY, current -> PoolUpdate.unchanged(current, null)));

      release.countDown();
      held.get(10, TimeUnit.SECONDS);
    } finally {
      release.countDown();
      holder.shutdownNow();
    }
  }

  @Test
  void concurrentSwapsAreSerializedPerPool() throws Exception {
    properties.setPoolLockTimeout(Duration.ofSeconds(30));
    LiquidityManager liquidityManager =
        new LiquidityManager(
            poolStore, positionLedger, new LoggingSettlementService(), properties, metrics);
    SwapExecutor swapExecutor =
        new SwapExecutor(
            poolStore, tradeLedger, new LoggingSettlementService(), properties, metrics);
    liquidityManager.addLiquidity(
        "DATA", "USDC", new BigDecimal("1000"), new BigDecimal("4000"), "lp1");

    int threads = 6;
    int swapsPerThread = 5;
    BigDecimal amount = new BigDecimal("5");
    ExecutorService workers = Executors.newFixedThreadPool(threads);
    try {
      List<Callable<Void>> tasks = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        String trader = "trader-" + t;
        tasks.add(
            () -> {
              for (int i = 0; i < swapsPerThread; i++) {
                swapExecutor.executeSwap(
                    new ExecuteSwapCommand("DATA", "USDC", amount, BigDecimal.ZERO, trader, null));
              }
              return null;
            });
      }
      for (Future<Void> future : workers.invokeAll(tasks)) {
        future.get();
      }
    } finally {
      workers.shutdownNow();
    }

    BigDecimal reserveIn = new BigDecimal("1000");
    BigDecimal reserveOut = new BigDecimal("4000");
    for (int i = 0; i < threads * swapsPerThread; i++) {
      SwapQuote quote =
          PricingEngine.quoteSwap(reserveIn, reserveOut, amount, properties.getFeeRateBps());
      reserveIn = reserveIn.add(amount);
      reserveOut = reserveOut.subtract(quote.amountOut());
    }

    Pool stored = poolStore.getPool(KEY);
    assertEquals(0, reserveIn.compareTo(stored.reserveA()));
    assertEquals(0, reserveOut.compareTo(stored.reserveB()));
    assertEquals(threads * swapsPerThread, tradeLedger.recentTrades(100).size());
  }

  @Test
  void mixedCaseTokensFollowCodePointOrder() {
    PairKey checksummed = PairKey.of("0xa1", "0xB0");
    PairKey upper = PairKey.of("B", "C");
    PairKey lower = PairKey.of("ab", "zz");

    Pool created = poolStore.createPoolIfAbsent(checksummed);
    poolStore.createPoolIfAbsent(lower);
    poolStore.createPoolIfAbsent(upper);

    assertEquals("0xB0", created.pairKey().tokenA());
    assertEquals(
        List.of(checksummed, upper, lower),
        poolStore.listPools().stream().map(Pool::pairKey).toList());
  }

  @Test
  void failedSettlementRollsBackPoolAndTrade() {
    LiquidityManager liquidityManager =
        new LiquidityManager(
            poolStore, positionLedger, new LoggingSettlementService(), properties, metrics);
    liquidityManager.addLiquidity(
        "DATA", "USDC", new BigDecimal("1000"), new BigDecimal("4000"), "lp1");
    Pool before = poolStore.getPool(KEY);
    SettlementService offline =
        request -> {
          throw new SettlementException("custody offline");
        };
    SwapExecutor swapExecutor =
        new SwapExecutor(poolStore, tradeLedger, offline, properties, metrics);

    assertThrows(
        SettlementException.class,
        () ->
            swapExecutor.executeSwap(
                new ExecuteSwapCommand(
                    "DATA", "USDC", new BigDecimal("100"), BigDecimal.ZERO, "alice", "c-1")));

    assertEquals(0, before.reserveA().compareTo(poolStore.getPool(KEY).reserveA()));
    assertEquals(0, before.reserveB().compareTo(poolStore.getPool(KEY).reserveB()));
    assertTrue(tradeLedger.recentTrades(10).isEmpty());
    assertTrue(tradeLedger.findByClientTradeId("alice", "c-1").isEmpty());
  }

  @Test
  void failedSettlementRollsBackPosition() {
    LiquidityManager offline =
        new LiquidityManager(
            poolStore,
            positionLedger,
            request -> {
              throw new SettlementException("custody offline");
            },
            properties,
            metrics);

    assertThrows(
        SettlementException.class,
        () ->
            offline.addLiquidity(
                "DATA", "USDC", new BigDecimal("1000"), new BigDecimal("4000"), "lp1"));

    assertTrue(poolStore.getPool(KEY).isEmpty());
    assertEquals(0, BigDecimal.ZERO.compareTo(positionLedger.unitsHeld(KEY, "lp1")));
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      latch.await(10, TimeUnit.SECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }
}
