package storedb.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import storedb.TxOptions;
import storedb.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * One attempt's transaction. Borrows a connection on {@link #begin}, and hands it back
 * to the pool right after the single terminal {@link #commit()} or {@link #rollback()},
 * restoring the connection settings it changed.
 */
final class JdbcTransaction {
  private static final Logger logger = LoggerFactory.getLogger(JdbcTransaction.class);

  private final Connection connection;
  private final int previousIsolation;
  private final boolean previousReadOnly;
  private boolean completed;

  private JdbcTransaction(Connection connection, int previousIsolation, boolean previousReadOnly) {
    this.connection = connection;
    this.previousIsolation = previousIsolation;
    this.previousReadOnly = previousReadOnly;
  }

  /**
   * Borrows a connection and starts a transaction with the given isolation and read-only
   * hint. On failure the connection is returned before the error propagates.
   */
  static JdbcTransaction begin(ConnectionProvider connectionProvider, TxOptions options) throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      int previousIsolation = connection.getTransactionIsolation();
      boolean previousReadOnly = connection.isReadOnly();
      connection.setTransactionIsolation(options.isolationLevel().jdbcLevel());
      connection.setReadOnly(options.readOnly());
      connection.setAutoCommit(false);
      return new JdbcTransaction(connection, previousIsolation, previousReadOnly);
    } catch (SQLException | RuntimeException e) {
      try {
        connection.close();
      } catch (SQLException closeError) {
        e.addSuppressed(closeError);
      }
      throw e;
    }
  }

  Connection connection() {
    return connection;
  }

  /**
   * Commits. A failed commit ends the attempt as well; the pool discards whatever the
   * server left open when the connection is returned.
   */
  void commit() throws SQLException {
    ensureNotCompleted();
    completed = true;
    try {
      connection.commit();
    } finally {
      release();
    }
  }

  void rollback() throws SQLException {
    ensureNotCompleted();
    completed = true;
    try {
      connection.rollback();
    } finally {
      release();
    }
  }

  private void ensureNotCompleted() {
    if (completed) {
      throw new IllegalStateException("Transaction already completed");
    }
  }

  // The outcome is already decided here; reset failures only cost the pool a connection.
  private void release() {
    try {
      connection.setAutoCommit(true);
      connection.setTransactionIsolation(previousIsolation);
      connection.setReadOnly(previousReadOnly);
    } catch (SQLException e) {
      logger.warn("Failed to reset connection after transaction", e);
    } finally {
      try {
        connection.close();
      } catch (SQLException e) {
        logger.warn("Failed to return connection to pool", e);
      }
    }
  }
}
