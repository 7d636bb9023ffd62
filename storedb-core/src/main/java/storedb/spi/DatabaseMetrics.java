package storedb.spi;

/**
 * Observability hook for exporting transaction and query counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything silently. Implement this interface
 * to bridge into Micrometer or another monitoring system.
 */
public interface DatabaseMetrics {

    /**
     * No-op instance that discards all metrics.
     */
    DatabaseMetrics NOOP = new Noop();

    /**
     * Increments the count of transaction attempts started again after a serialization conflict.
     */
    void incrementTransactionRetry();

    /**
     * Increments the count of transactions abandoned because every attempt hit a conflict.
     */
    void incrementRetriesExhausted();

    /**
     * Records the duration of a single query primitive.
     *
     * @param kind       query kind label ({@code get}, {@code select}, {@code start query}, {@code exec})
     * @param durationMs elapsed time in milliseconds (always non-negative)
     */
    default void recordQueryDurationMs(String kind, long durationMs) {
    }

    /**
     * Increments the count of queries that exceeded the slow-query threshold.
     *
     * @param kind query kind label
     */
    default void incrementSlowQuery(String kind) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements DatabaseMetrics {
        @Override
        public void incrementTransactionRetry() {
        }

        @Override
        public void incrementRetriesExhausted() {
        }
    }
}
