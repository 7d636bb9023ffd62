package storedb.jdbc;

import storedb.ConflictClassifier;
import storedb.SerializationRetriesExhaustedException;

import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Recognizes PostgreSQL's {@code serialization_failure} (40001) and
 * {@code deadlock_detected} (40P01) SQLStates anywhere in the cause chain or in a
 * {@link SQLException#getNextException() next-exception} chain, following both links from
 * every exception reached.
 *
 * <p>Stateless; use {@link #INSTANCE}.
 */
public final class SqlStateConflictClassifier implements ConflictClassifier {
  public static final String SERIALIZATION_FAILURE = "40001";
  public static final String DEADLOCK_DETECTED = "40P01";

  public static final SqlStateConflictClassifier INSTANCE = new SqlStateConflictClassifier();

  private SqlStateConflictClassifier() {
  }

  @Override
  public boolean isSerializationConflict(Throwable error) {
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    Deque<Throwable> pending = new ArrayDeque<>();
    if (error != null) {
      pending.push(error);
    }
    while (!pending.isEmpty()) {
      Throwable t = pending.pop();
      if (!seen.add(t)) {
        continue;
      }
      if (t instanceof SerializationRetriesExhaustedException) {
        return false;
      }
      if (t instanceof SQLException sql) {
        if (isConflictState(sql.getSQLState())) {
          return true;
        }
        if (sql.getNextException() != null) {
          pending.push(sql.getNextException());
        }
      }
      if (t.getCause() != null) {
        pending.push(t.getCause());
      }
    }
    return false;
  }

  private static boolean isConflictState(String sqlState) {
    return SERIALIZATION_FAILURE.equals(sqlState) || DEADLOCK_DETECTED.equals(sqlState);
  }

  @Override
  public String toString() {
    return "SqlStateConflictClassifier{" + SERIALIZATION_FAILURE + ", " + DEADLOCK_DETECTED + '}';
  }
}
