package com.dataexchange.exchangeapi.liquidity;

import com.dataexchange.domain.pools.InsufficientPositionException;
import com.dataexchange.domain.pools.PairKey;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcPositionLedger implements PositionLedger {
  private final JdbcTemplate jdbcTemplate;

  public JdbcPositionLedger(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public BigDecimal unitsHeld(PairKey pairKey, String provider) {
    String sql = "SELECT units FROM liquidity_positions WHERE pair_key = ? AND provider = ?";
    List<BigDecimal> rows =
        jdbcTemplate.queryForList(sql, BigDecimal.class, pairKey.value(), provider);
    return rows.isEmpty() ? BigDecimal.ZERO : rows.get(0);
  }

  @Override
  public BigDecimal credit(PairKey pairKey, String provider, BigDecimal units) {
    String sql =
        """
        INSERT INTO liquidity_positions (pair_key, provider, units, updated_at)
        VALUES (?, ?, ?, NOW())
        ON CONFLICT (pair_key, provider)
        DO UPDATE SET units = liquidity_positions.units + EXCLUDED.units, updated_at = NOW()
        RETURNING units
        """;
    return jdbcTemplate.queryForObject(sql, BigDecimal.class, pairKey.value(), provider, units);
  }

  @Override
  public BigDecimal debit(PairKey pairKey, String provider, BigDecimal units) {
    String sql =
        """
        UPDATE liquidity_positions
        SET units = units - ?, updated_at = NOW()
        WHERE pair_key = ? AND provider = ? AND units >= ?
        RETURNING units
        """;
    List<BigDecimal> rows =
        jdbcTemplate.queryForList(sql, BigDecimal.class, units, pairKey.value(), provider, units);
    if (rows.isEmpty()) {
      throw new InsufficientPositionException(
          provider, pairKey, units, unitsHeld(pairKey, provider));
    }
    return rows.get(0);
  }

  @Override
  public List<PositionHolding> holdingsOf(String provider) {
    String sql =
        """
        SELECT pair_key, provider, units, updated_at
        FROM liquidity_positions
        WHERE provider = ? AND units > 0
        ORDER BY pair_key
        """;
    return jdbcTemplate.query(sql, this::mapRow, provider);
  }

  private PositionHolding mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new PositionHolding(
        PairKey.parse(rs.getString("pair_key")),
        rs.getString("provider"),
        rs.getBigDecimal("units"),
        rs.getTimestamp("updated_at").toInstant());
  }
}
