package storedb;

/**
 * Decides whether a failure is a serialization conflict the executor may retry.
 *
 * <p>Implementations must be pure and stateless: no I/O, same answer for the same error.
 * The JDBC module ships {@code SqlStateConflictClassifier}; tests substitute their own
 * predicate to drive the retry loop without a database.
 */
@FunctionalInterface
public interface ConflictClassifier {

  /**
   * @param error the failure raised by the transactional function or by commit
   * @return {@code true} if the whole transaction should be attempted again
   */
  boolean isSerializationConflict(Throwable error);

  /**
   * Sorts an error into an {@link ErrorKind}.
   *
   * @param error the failure, or {@code null} when there was none
   */
  default ErrorKind classify(Throwable error) {
    if (error == null) {
      return ErrorKind.NONE;
    }
    return isSerializationConflict(error) ? ErrorKind.SERIALIZATION_CONFLICT : ErrorKind.OTHER;
  }
}
