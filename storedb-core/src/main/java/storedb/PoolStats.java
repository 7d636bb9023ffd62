package storedb;

/**
 * Point-in-time snapshot of the connection pool.
 *
 * @param maxPoolSize configured pool capacity
 * @param total       connections currently open
 * @param active      connections lent out
 * @param idle        connections waiting in the pool
 * @param awaiting    threads blocked waiting for a connection
 */
public record PoolStats(int maxPoolSize, int total, int active, int idle, int awaiting) {

  /** Returned when the data source does not expose pool statistics. */
  public static final PoolStats UNAVAILABLE = new PoolStats(-1, -1, -1, -1, -1);

  public boolean isAvailable() {
    return maxPoolSize >= 0;
  }
}
