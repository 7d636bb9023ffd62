package storedb;

import java.sql.SQLException;

/**
 * Thrown when an {@link OperationContext} is cancelled or past its deadline, or when the
 * calling thread is interrupted while waiting between attempts.
 *
 * <p>Uses the PostgreSQL {@code query_canceled} state so it reads like the driver's own
 * cancellation error. It is never a serialization conflict.
 */
public final class OperationCancelledException extends SQLException {
  public static final String SQLSTATE = "57014";

  public OperationCancelledException(String message) {
    super(message, SQLSTATE);
  }

  public OperationCancelledException(String message, Throwable cause) {
    super(message, SQLSTATE, cause);
  }
}
