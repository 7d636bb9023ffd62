package storedb;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Direct query primitives. Implemented by the database facade (one pooled connection per
 * call, auto-commit) and by {@link Tx} (the transaction's connection).
 */
public interface QueryRunner {

  /**
   * Runs a query and maps its first row.
   *
   * @return the mapped row, empty when the query returned none
   */
  <T> Optional<T> get(RowMapper<T> mapper, String sql, Object... args) throws SQLException;

  /**
   * Runs a query and maps every row.
   */
  <T> List<T> select(RowMapper<T> mapper, String sql, Object... args) throws SQLException;

  /**
   * Runs a query and returns an open cursor. The caller must close it.
   */
  Rows query(String sql, Object... args) throws SQLException;

  /**
   * Runs a statement that returns no rows.
   *
   * @return rows affected
   */
  long exec(String sql, Object... args) throws SQLException;
}
