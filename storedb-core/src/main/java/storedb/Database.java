package storedb;

/**
 * Full database facade: direct queries, transactional execution and server metadata.
 *
 * <p>Prefer depending on {@link Transactor}, {@link QueryRunner} or {@link MetadataSource}
 * when only one capability is needed.
 */
public interface Database extends Transactor, QueryRunner, MetadataSource, AutoCloseable {

  /**
   * Connection pool snapshot, or {@link PoolStats#UNAVAILABLE}.
   */
  PoolStats stats();

  /**
   * Returns a new facade bound to {@code context}: its calls observe the context's
   * cancellation and deadline and log with its fields. This facade is unaffected.
   */
  Database withContext(OperationContext context);

  /**
   * Releases the connection pool when the facade owns it.
   */
  @Override
  void close();
}
