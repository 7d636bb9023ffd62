package storedb;

import java.sql.SQLException;

/**
 * Runs work inside a serializable transaction, retrying on serialization conflicts.
 *
 * <p>The narrowest capability: consumers that only need transactional execution
 * depend on this and nothing else.
 */
public interface Transactor {

  /**
   * Runs {@code fn} in a transaction and commits it.
   *
   * <p>Serialization conflicts raised by {@code fn} or by commit roll the attempt back
   * and start over, up to the configured attempt budget. Every other failure is
   * rethrown unchanged.
   *
   * @return what {@code fn} returned on the attempt that committed
   * @throws SerializationRetriesExhaustedException if every attempt conflicted
   * @throws SQLException the first non-conflict failure, or a failed rollback
   */
  <T> T execute(TxFunction<T> fn, TxOption... options) throws SQLException;
}
