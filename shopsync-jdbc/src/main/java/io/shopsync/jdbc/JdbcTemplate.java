package io.shopsync.jdbc;

import io.shopsync.LocalStoreException;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Lightweight JDBC helper to reduce boilerplate in the local store implementations.
 *
 * <p>Parameters of type {@link Instant} and {@link LocalDate} are bound as
 * {@link Timestamp} and {@link Date}. Every {@link SQLException} is rethrown as
 * {@link LocalStoreException}.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute INSERT/UPDATE/DELETE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new LocalStoreException("Failed to execute update: " + sql, e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw new LocalStoreException("Failed to execute query: " + sql, e);
    }
  }

  /** Execute a single-value SELECT such as {@code COUNT(*)}. */
  public static int queryForInt(Connection conn, String sql, Object... params) {
    List<Integer> values = query(conn, sql, rs -> rs.getInt(1), params);
    return values.isEmpty() ? 0 : values.get(0);
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Boolean b) {
        ps.setBoolean(i + 1, b);
      } else if (param instanceof BigDecimal d) {
        ps.setBigDecimal(i + 1, d);
      } else if (param instanceof Instant instant) {
        ps.setTimestamp(i + 1, Timestamp.from(instant));
      } else if (param instanceof LocalDate date) {
        ps.setDate(i + 1, Date.valueOf(date));
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else if (param instanceof Enum<?> e) {
        ps.setString(i + 1, e.name());
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
