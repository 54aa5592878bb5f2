package com.dataexchange.exchangeapi.pools;

import com.dataexchange.domain.pools.PairKey;
import com.dataexchange.domain.pools.Pool;
import com.dataexchange.domain.pools.PoolNotFoundException;
import com.dataexchange.exchangeapi.config.AmmProperties;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Pool rows in {@code liquidity_pools}. The per-pool lock is the row lock taken by {@code SELECT
 * ... FOR UPDATE}; it lives as long as the transaction opened by {@link #withPoolLock}, so trade
 * and position writes made by the mutation, and its final step, commit or roll back with the pool.
 */
@Repository
public class JdbcPoolStore implements PoolStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcPoolStore.class);

  private static final String POOL_COLUMNS =
      "token_a, token_b, reserve_a, reserve_b, total_liquidity_units, created_at, updated_at";

  private final JdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;
  private final AmmProperties properties;

  public JdbcPoolStore(
      JdbcTemplate jdbcTemplate,
      PlatformTransactionManager transactionManager,
      AmmProperties properties) {
    this.jdbcTemplate = jdbcTemplate;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.properties = properties;
  }

  @Override
  public Pool getPool(PairKey pairKey) {
    return findPool(pairKey).orElseThrow(() -> new PoolNotFoundException(pairKey));
  }

  @Override
  public Optional<Pool> findPool(PairKey pairKey) {
    String sql = "SELECT " + POOL_COLUMNS + " FROM liquidity_pools WHERE pair_key = ?";
    List<Pool> rows = jdbcTemplate.query(sql, this::mapRow, pairKey.value());
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public List<Pool> listPools() {
    String sql = "SELECT " + POOL_COLUMNS + " FROM liquidity_pools ORDER BY pair_key";
    return jdbcTemplate.query(sql, this::mapRow);
  }

  @Override
  public Pool createPoolIfAbsent(PairKey pairKey) {
    String sql =
        """
        INSERT INTO liquidity_pools (pair_key, token_a, token_b, reserve_a, reserve_b,
                                     total_liquidity_units, created_at, updated_at)
        VALUES (?, ?, ?, 0, 0, 0, NOW(), NOW())
        ON CONFLICT (pair_key) DO NOTHING
        """;
    int inserted = jdbcTemplate.update(sql, pairKey.value(), pairKey.tokenA(), pairKey.tokenB());
    if (inserted > 0) {
      log.info("Created pool pairKey={}", pairKey);
    }
    return getPool(pairKey);
  }

  @Override
  public <T> T withPoolLock(PairKey pairKey, PoolMutation<T> mutation) {
    Objects.requireNonNull(mutation, "mutation must not be null");
    try {
      return transactionTemplate.execute(
          status -> {
            long timeoutMillis = Math.max(1L, properties.getPoolLockTimeout().toMillis());
            jdbcTemplate.execute("SET LOCAL lock_timeout = " + timeoutMillis);
            Pool current =
                selectForUpdate(pairKey).orElseThrow(() -> new PoolNotFoundException(pairKey));
            PoolUpdate<T> update = mutation.apply(current);
            Objects.requireNonNull(update, "mutation must return a PoolUpdate");
            Pool next = update.pool();
            if (!next.pairKey().equals(pairKey)) {
              throw new IllegalStateException(
                  "Mutation of pool " + pairKey + " returned pool " + next.pairKey());
            }
            if (!next.equals(current)) {
              updatePool(next);
            }
            update.runFinalStep();
            return update.result();
          });
    } catch (PessimisticLockingFailureException ex) {
      log.warn("Pool lock not acquired pairKey={} reason={}", pairKey, ex.getMessage());
      throw new PoolBusyException(pairKey, properties.getPoolLockTimeout(), ex);
    }
  }

  private Optional<Pool> selectForUpdate(PairKey pairKey) {
    String sql =
        "SELECT " + POOL_COLUMNS + " FROM liquidity_pools WHERE pair_key = ? FOR UPDATE";
    List<Pool> rows = jdbcTemplate.query(sql, this::mapRow, pairKey.value());
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  private void updatePool(Pool pool) {
    String sql =
        """
        UPDATE liquidity_pools
        SET reserve_a = ?, reserve_b = ?, total_liquidity_units = ?, updated_at = ?
        WHERE pair_key = ?
        """;
    jdbcTemplate.update(
        sql,
        pool.reserveA(),
        pool.reserveB(),
        pool.totalLiquidityUnits(),
        Timestamp.from(pool.updatedAt()),
        pool.pairKey().value());
  }

  private Pool mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Pool(
        new PairKey(rs.getString("token_a"), rs.getString("token_b")),
        rs.getBigDecimal("reserve_a"),
        rs.getBigDecimal("reserve_b"),
        rs.getBigDecimal("total_liquidity_units"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant());
  }
}
