package com.dataexchange.exchangeapi.liquidity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dataexchange.domain.pools.InsufficientPositionException;
import com.dataexchange.domain.pools.PairKey;
import com.dataexchange.exchangeapi.config.AmmProperties;
import com.dataexchange.exchangeapi.pools.JdbcPoolStore;
import java.math.BigDecimal;
import java.util.List;
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
class JdbcPositionLedgerIntegrationTest {
  private static final PairKey DATA_USDC = PairKey.of("DATA", "USDC");
  private static final PairKey DATA_WETH = PairKey.of("DATA", "WETH");

  @Container
  static final PostgreSQLContainer<?> POSTGRES =
      new PostgreSQLContainer<>("postgres:16")
          .withDatabaseName("exchange")
          .withUsername("exchange")
          .withPassword("exchange");

  private JdbcPositionLedger ledger;

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

    JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
    JdbcPoolStore poolStore =
        new JdbcPoolStore(
            jdbcTemplate, new DataSourceTransactionManager(dataSource), new AmmProperties());
    poolStore.createPoolIfAbsent(DATA_USDC);
    poolStore.createPoolIfAbsent(DATA_WETH);
    ledger = new JdbcPositionLedger(jdbcTemplate);
  }

  @Test
  void creditsAccumulatePerPoolAndProvider() {
    assertEquals(0, new BigDecimal("5").compareTo(ledger.credit(DATA_USDC, "lp1", new BigDecimal("5"))));
    assertEquals(0, new BigDecimal("7.5").compareTo(ledger.credit(DATA_USDC, "lp1", new BigDecimal("2.5"))));
    ledger.credit(DATA_USDC, "lp2", BigDecimal.ONE);

    assertEquals(0, new BigDecimal("7.5").compareTo(ledger.unitsHeld(DATA_USDC, "lp1")));
    assertEquals(0, BigDecimal.ZERO.compareTo(ledger.unitsHeld(DATA_WETH, "lp1")));
  }

  @Test
  void debitReturnsRemainingUnits() {
    ledger.credit(DATA_USDC, "lp1", new BigDecimal("10"));

    assertEquals(0, new BigDecimal("4").compareTo(ledger.debit(DATA_USDC, "lp1", new BigDecimal("6"))));
    assertEquals(0, BigDecimal.ZERO.compareTo(ledger.debit(DATA_USDC, "lp1", new BigDecimal("4"))));
  }

  @Test
  void overdrawIsRejectedWithHeldAmount() {
    ledger.credit(DATA_USDC, "lp1", new BigDecimal("3"));

    InsufficientPositionException ex =
        assertThrows(
            InsufficientPositionException.class,
            () -> ledger.debit(DATA_USDC, "lp1", new BigDecimal("3.000000000000000001")));
    assertEquals(0, new BigDecimal("3").compareTo(ex.held()));
    assertThrows(
        InsufficientPositionException.class,
        () -> ledger.debit(DATA_WETH, "lp1", BigDecimal.ONE));
  }

  @Test
  void holdingsSkipFullyWithdrawnPositions() {
    ledger.credit(DATA_USDC, "lp1", new BigDecimal("3"));
    ledger.credit(DATA_WETH, "lp1", new BigDecimal("4"));
    ledger.debit(DATA_USDC, "lp1", new BigDecimal("3"));

    List<PositionHolding> holdings = ledger.holdingsOf("lp1");
    assertEquals(1, holdings.size());
    assertEquals(DATA_WETH, holdings.get(0).pairKey());
    assertTrue(ledger.holdingsOf("lp2").isEmpty());
  }
}
