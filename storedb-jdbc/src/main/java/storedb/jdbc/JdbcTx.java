package storedb.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import storedb.RowMapper;
import storedb.Rows;
import storedb.Tx;
import storedb.TxOptions;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link Tx} bound to the connection of a single attempt. The executor invalidates it
 * before committing or rolling back, closing any cursor the function left open.
 */
final class JdbcTx implements Tx {
  private static final Logger logger = LoggerFactory.getLogger(JdbcTx.class);

  private final Connection connection;
  private final TxOptions options;
  private final QueryInstrumentation instrumentation;
  private final List<JdbcRows> openRows = new ArrayList<>();
  private boolean active = true;

  JdbcTx(Connection connection, TxOptions options, QueryInstrumentation instrumentation) {
    this.connection = connection;
    this.options = options;
    this.instrumentation = instrumentation;
  }

  @Override
  public TxOptions options() {
    return options;
  }

  @Override
  public <T> Optional<T> get(RowMapper<T> mapper, String sql, Object... args) throws SQLException {
    ensureActive();
    return instrumentation.run(QueryKind.GET, sql, args,
        () -> JdbcTemplate.queryFirst(connection, options.context(), mapper, sql, args));
  }

  @Override
  public <T> List<T> select(RowMapper<T> mapper, String sql, Object... args) throws SQLException {
    ensureActive();
    return instrumentation.run(QueryKind.SELECT, sql, args,
        () -> JdbcTemplate.query(connection, options.context(), mapper, sql, args));
  }

  @Override
  public Rows query(String sql, Object... args) throws SQLException {
    ensureActive();
    JdbcRows rows = instrumentation.run(QueryKind.QUERY, sql, args,
        () -> JdbcTemplate.open(connection, options.context(), false, sql, args));
    openRows.add(rows);
    return rows;
  }

  @Override
  public long exec(String sql, Object... args) throws SQLException {
    ensureActive();
    return instrumentation.run(QueryKind.EXEC, sql, args,
        () -> JdbcTemplate.update(connection, options.context(), sql, args));
  }

  void invalidate() {
    active = false;
    for (JdbcRows rows : openRows) {
      if (rows.isClosed()) {
        continue;
      }
      try {
        rows.close();
      } catch (SQLException e) {
        logger.warn("Failed to close rows left open by transactional function", e);
      }
    }
    openRows.clear();
  }

  private void ensureActive() {
    if (!active) {
      throw new IllegalStateException("Transaction already finished; Tx must not escape its function");
    }
  }
}
