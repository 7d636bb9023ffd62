package storedb;

import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import java.util.Objects;

/**
 * A single override applied to {@link TxOptions.Builder}.
 *
 * <pre>{@code
 * db.execute(tx -> tx.get(rs -> rs.getString(1), "SELECT version()"),
 *     TxOption.readOnly(), TxOption.silent());
 * }</pre>
 */
@FunctionalInterface
public interface TxOption {

  void applyTo(TxOptions.Builder builder);

  /**
   * Marks the transaction read-only. It still takes part in conflict retries.
   */
  static TxOption readOnly() {
    return b -> b.readOnly(true);
  }

  /**
   * Overrides the default serializable isolation.
   */
  static TxOption withIsolation(IsolationLevel level) {
    Objects.requireNonNull(level, "level");
    return b -> b.isolationLevel(level);
  }

  /**
   * Overrides the logger used for retry warnings and slow-query entries.
   */
  static TxOption withLogger(Logger logger) {
    Objects.requireNonNull(logger, "logger");
    return b -> b.logger(logger);
  }

  /**
   * Discards all log output; for noisy internal calls.
   */
  static TxOption silent() {
    return withLogger(NOPLogger.NOP_LOGGER);
  }

  /**
   * Binds a cancellation and deadline scope.
   */
  static TxOption withContext(OperationContext context) {
    Objects.requireNonNull(context, "context");
    return b -> b.context(context);
  }
}
