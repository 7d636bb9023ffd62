package storedb;

import java.sql.SQLException;

/**
 * Thrown when every attempt of a transaction ended in a serialization conflict.
 *
 * <p>Distinct from the driver's own conflict error so callers can tell "gave up after
 * contention" apart from a single conflict. Its SQLState is {@value #SQLSTATE}, which no
 * conflict classifier treats as retryable.
 */
public final class SerializationRetriesExhaustedException extends SQLException {
  public static final String SQLSTATE = "SD001";

  private final int attempts;

  public SerializationRetriesExhaustedException(int attempts) {
    super("serialization error: transaction failed after " + attempts + " attempts", SQLSTATE);
    this.attempts = attempts;
  }

  /**
   * @return how many attempts were made before giving up
   */
  public int attempts() {
    return attempts;
  }
}
