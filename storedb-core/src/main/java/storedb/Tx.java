package storedb;

/**
 * Handle to a live transaction, passed to a {@link TxFunction}.
 *
 * <p>Valid only while the function runs. Once the attempt commits or rolls back every
 * method throws {@link IllegalStateException}.
 */
public interface Tx extends QueryRunner {

  /**
   * The options the transaction was started with.
   */
  TxOptions options();
}
