package storedb.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import storedb.OperationContext;
import storedb.RowMapper;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Statement plumbing shared by the facade and by {@link JdbcTx}. Every statement checks
 * the operation context first, gets a query timeout from its deadline, and is cancelled
 * if the context is cancelled while it runs.
 */
final class JdbcTemplate {
  private static final Logger logger = LoggerFactory.getLogger(JdbcTemplate.class);

  /** Execute SELECT, map the first row. */
  static <T> Optional<T> queryFirst(Connection conn, OperationContext ctx, RowMapper<T> mapper,
      String sql, Object... params) throws SQLException {
    try (PreparedStatement ps = prepare(conn, ctx, sql, params);
         OperationContext.Registration cancel = ctx.onCancel(() -> cancel(ps));
         ResultSet rs = ps.executeQuery()) {
      return rs.next() ? Optional.ofNullable(mapper.map(rs)) : Optional.empty();
    }
  }

  /** Execute SELECT, map rows. */
  static <T> List<T> query(Connection conn, OperationContext ctx, RowMapper<T> mapper,
      String sql, Object... params) throws SQLException {
    try (PreparedStatement ps = prepare(conn, ctx, sql, params);
         OperationContext.Registration cancel = ctx.onCancel(() -> cancel(ps));
         ResultSet rs = ps.executeQuery()) {
      List<T> results = new ArrayList<>();
      while (rs.next()) {
        results.add(mapper.map(rs));
      }
      return results;
    }
  }

  /** Execute INSERT/UPDATE/DELETE/DDL, return rows affected. */
  static long update(Connection conn, OperationContext ctx, String sql, Object... params) throws SQLException {
    try (PreparedStatement ps = prepare(conn, ctx, sql, params);
         OperationContext.Registration cancel = ctx.onCancel(() -> cancel(ps))) {
      return ps.executeUpdate();
    }
  }

  /**
   * Execute SELECT and hand the open cursor to the caller.
   *
   * @param ownsConnection close {@code conn} together with the cursor
   */
  static JdbcRows open(Connection conn, OperationContext ctx, boolean ownsConnection,
      String sql, Object... params) throws SQLException {
    PreparedStatement ps = prepare(conn, ctx, sql, params);
    OperationContext.Registration cancel = ctx.onCancel(() -> cancel(ps));
    try {
      ResultSet rs = ps.executeQuery();
      return new JdbcRows(ps, rs, cancel, ownsConnection ? conn : null);
    } catch (SQLException | RuntimeException e) {
      cancel.close();
      closeAfterFailure(ps, e);
      throw e;
    }
  }

  private static PreparedStatement prepare(Connection conn, OperationContext ctx, String sql,
      Object... params) throws SQLException {
    ctx.checkActive();
    PreparedStatement ps = conn.prepareStatement(sql);
    try {
      Optional<Duration> remaining = ctx.remaining();
      if (remaining.isPresent()) {
        ps.setQueryTimeout(timeoutSeconds(remaining.get()));
      }
      bindParams(ps, params);
      return ps;
    } catch (SQLException | RuntimeException e) {
      closeAfterFailure(ps, e);
      throw e;
    }
  }

  // JDBC timeouts are whole seconds and 0 means none, so round up
  static int timeoutSeconds(Duration remaining) {
    long millis = remaining.toMillis();
    long seconds = (millis + 999) / 1000;
    return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, seconds));
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    if (params == null) {
      return;
    }
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private static void cancel(Statement statement) {
    try {
      statement.cancel();
    } catch (SQLException e) {
      logger.warn("Failed to cancel running statement", e);
    }
  }

  private static void closeAfterFailure(Statement statement, Exception failure) {
    try {
      statement.close();
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }

  private JdbcTemplate() {}
}
