package storedb.jdbc;

import storedb.OperationContext;
import storedb.RowMapper;
import storedb.Rows;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * {@link Rows} over an open {@link ResultSet}. Closing releases the result set, the
 * statement, the cancellation hook and, when owned, the connection.
 */
final class JdbcRows implements Rows {
  private final PreparedStatement statement;
  private final ResultSet resultSet;
  private final OperationContext.Registration cancel;
  private final Connection ownedConnection;
  private boolean closed;

  JdbcRows(PreparedStatement statement, ResultSet resultSet, OperationContext.Registration cancel,
      Connection ownedConnection) {
    this.statement = statement;
    this.resultSet = resultSet;
    this.cancel = cancel;
    this.ownedConnection = ownedConnection;
  }

  @Override
  public boolean next() throws SQLException {
    ensureOpen();
    return resultSet.next();
  }

  @Override
  public <T> T map(RowMapper<T> mapper) throws SQLException {
    ensureOpen();
    return mapper.map(resultSet);
  }

  @Override
  public ResultSet resultSet() {
    return resultSet;
  }

  boolean isClosed() {
    return closed;
  }

  @Override
  public void close() throws SQLException {
    if (closed) {
      return;
    }
    closed = true;
    SQLException first = null;
    try {
      resultSet.close();
    } catch (SQLException e) {
      first = e;
    }
    cancel.close();
    try {
      statement.close();
    } catch (SQLException e) {
      if (first == null) first = e;
      else first.addSuppressed(e);
    }
    if (ownedConnection != null) {
      try {
        ownedConnection.close();
      } catch (SQLException e) {
        if (first == null) first = e;
        else first.addSuppressed(e);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  private void ensureOpen() throws SQLException {
    if (closed) {
      throw new SQLException("Rows already closed");
    }
  }
}
