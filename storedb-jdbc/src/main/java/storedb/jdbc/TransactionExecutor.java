package storedb.jdbc;

import storedb.ConflictClassifier;
import storedb.OperationCancelledException;
import storedb.RetryPolicy;
import storedb.SerializationRetriesExhaustedException;
import storedb.Transactor;
import storedb.TxFunction;
import storedb.TxOption;
import storedb.TxOptions;
import storedb.spi.ConnectionProvider;
import storedb.spi.DatabaseMetrics;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;

/**
 * Runs transactional functions and retries them when the database aborts the
 * transaction with a serialization conflict.
 *
 * <p>Each attempt borrows its own connection, begins a transaction with the requested
 * isolation and read-only hint, invokes the function and then commits or rolls back,
 * returning the connection to the pool before anything else happens. The outcome of an
 * attempt is decided as follows:
 * <ul>
 *   <li>begin fails: the error is rethrown, no retry;
 *   <li>the function fails and rollback fails: the rollback error is rethrown, even when
 *       the original failure was a conflict;
 *   <li>the function fails with a conflict: next attempt;
 *   <li>the function fails otherwise: the error is rethrown unchanged;
 *   <li>commit fails with a conflict: next attempt;
 *   <li>commit fails otherwise: the error is rethrown;
 *   <li>commit succeeds: the function's result is returned.
 * </ul>
 * When every attempt conflicted a {@link SerializationRetriesExhaustedException} is thrown.
 * Attempt {@code i} waits {@link RetryPolicy#delayBeforeAttempt(int)} on the calling thread
 * before it begins.
 *
 * <p>This class is thread-safe; concurrent calls share nothing but the connection pool.
 *
 * @see RetryPolicy
 * @see ConflictClassifier
 */
public final class TransactionExecutor implements Transactor {
  private final ConnectionProvider connectionProvider;
  private final RetryPolicy retryPolicy;
  private final ConflictClassifier conflictClassifier;
  private final DatabaseMetrics metrics;
  private final Sleeper sleeper;
  private final Duration slowQueryThreshold;

  private TransactionExecutor(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : RetryPolicy.defaults();
    this.conflictClassifier = builder.conflictClassifier != null
        ? builder.conflictClassifier : SqlStateConflictClassifier.INSTANCE;
    this.metrics = builder.metrics != null ? builder.metrics : DatabaseMetrics.NOOP;
    this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.THREAD;
    this.slowQueryThreshold = builder.slowQueryThreshold != null
        ? builder.slowQueryThreshold : QueryInstrumentation.DEFAULT_SLOW_QUERY_THRESHOLD;
    if (slowQueryThreshold.isNegative()) {
      throw new IllegalArgumentException("slowQueryThreshold must be >= 0");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  @Override
  public <T> T execute(TxFunction<T> fn, TxOption... options) throws SQLException {
    return execute(fn, TxOptions.of(options));
  }

  /**
   * Runs {@code fn} under {@code options}, retrying on serialization conflicts.
   *
   * @return the result of the attempt that committed
   * @throws SerializationRetriesExhaustedException if every attempt conflicted
   * @throws OperationCancelledException if the context is done before an attempt begins,
   *     or the thread is interrupted while backing off
   * @throws SQLException any other begin, function, rollback or commit failure
   */
  public <T> T execute(TxFunction<T> fn, TxOptions options) throws SQLException {
    Objects.requireNonNull(fn, "fn");
    Objects.requireNonNull(options, "options");
    int attempt = 0;
    while (attempt < retryPolicy.maxAttempts()) {
      if (attempt > 0) {
        backoff(attempt, options);
      }
      options.context().checkActive();

      JdbcTransaction tx = JdbcTransaction.begin(connectionProvider, options);
      JdbcTx handle = new JdbcTx(tx.connection(), options,
          new QueryInstrumentation(options.logger(), options.context(), slowQueryThreshold, metrics));
      T result;
      try {
        result = fn.apply(handle);
      } catch (Throwable failure) {
        handle.invalidate();
        rollbackAfter(tx, failure);
        if (failure instanceof Exception && conflictClassifier.isSerializationConflict(failure)) {
          attempt++;
          continue;
        }
        throw failure;
      }

      handle.invalidate();
      try {
        tx.commit();
      } catch (SQLException e) {
        if (conflictClassifier.isSerializationConflict(e)) {
          attempt++;
          continue;
        }
        throw e;
      }
      return result;
    }

    metrics.incrementRetriesExhausted();
    LogFields.withContext(options.logger().atWarn(), options.context())
        .addKeyValue("attempt", attempt)
        .log("transaction failed after max attempts due to serialization error");
    throw new SerializationRetriesExhaustedException(attempt);
  }

  // A failed rollback wins over whatever the function threw.
  private static void rollbackAfter(JdbcTransaction tx, Throwable failure) throws SQLException {
    try {
      tx.rollback();
    } catch (SQLException rollbackError) {
      rollbackError.addSuppressed(failure);
      throw rollbackError;
    }
  }

  private void backoff(int attempt, TxOptions options) throws OperationCancelledException {
    Duration delay = retryPolicy.delayBeforeAttempt(attempt);
    metrics.incrementTransactionRetry();
    LogFields.withContext(options.logger().atWarn(), options.context())
        .addKeyValue("attempt", attempt)
        .addKeyValue("sleep_interval", delay)
        .log("retrying transaction due to serialization error");
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new OperationCancelledException("interrupted while waiting to retry transaction", e);
    }
  }

  /**
   * Builder for {@link TransactionExecutor}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private RetryPolicy retryPolicy;
    private ConflictClassifier conflictClassifier;
    private DatabaseMetrics metrics;
    private Sleeper sleeper;
    private Duration slowQueryThreshold;

    private Builder() {
    }

    /**
     * Sets where each attempt borrows its connection from.
     *
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Optional. Defaults to {@link RetryPolicy#defaults()}.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Optional. Defaults to {@link SqlStateConflictClassifier#INSTANCE}.
     */
    public Builder conflictClassifier(ConflictClassifier conflictClassifier) {
      this.conflictClassifier = conflictClassifier;
      return this;
    }

    /**
     * Optional. Defaults to {@link DatabaseMetrics#NOOP}.
     */
    public Builder metrics(DatabaseMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to {@link Sleeper#THREAD}.
     */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * Sets the duration above which queries run through a {@code Tx} are logged.
     *
     * <p>Optional. Defaults to 100ms.
     */
    public Builder slowQueryThreshold(Duration slowQueryThreshold) {
      this.slowQueryThreshold = slowQueryThreshold;
      return this;
    }

    public TransactionExecutor build() {
      return new TransactionExecutor(this);
    }
  }
}
