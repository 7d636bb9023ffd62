package storedb;

import java.sql.SQLException;

/**
 * Work to run inside a transaction.
 *
 * <p>The executor may invoke the function several times when the database reports a
 * serialization conflict, so it must not have side effects outside the transaction that
 * are unsafe to repeat.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface TxFunction<T> {
  T apply(Tx tx) throws SQLException;
}
