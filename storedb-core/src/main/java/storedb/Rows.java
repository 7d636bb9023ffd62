package storedb;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * An open cursor over a query result.
 *
 * <p>When obtained from the database facade the cursor holds its own pooled connection
 * until {@link #close()}; when obtained from a {@link Tx} it borrows the transaction's.
 * Always use with try-with-resources.
 */
public interface Rows extends AutoCloseable {

  /**
   * Advances to the next row.
   *
   * @return {@code false} once the rows are exhausted
   */
  boolean next() throws SQLException;

  /**
   * Maps the current row.
   */
  <T> T map(RowMapper<T> mapper) throws SQLException;

  /**
   * The underlying result set, for callers that need column metadata.
   */
  ResultSet resultSet();

  @Override
  void close() throws SQLException;
}
