package storedb;

/**
 * Outcome classes a {@link ConflictClassifier} sorts failures into.
 */
public enum ErrorKind {
  /** No failure. */
  NONE,
  /** The database aborted the transaction to preserve serializable ordering, or broke a deadlock. */
  SERIALIZATION_CONFLICT,
  /** Anything else. Never retried. */
  OTHER
}
