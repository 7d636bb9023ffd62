package storedb.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import storedb.PoolStats;
import storedb.spi.DatabaseMetrics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import java.util.function.ToIntFunction;

/**
 * Micrometer-based implementation of {@link DatabaseMetrics}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code storedb.tx.retries}: transaction attempts restarted after a serialization conflict</li>
 *   <li>{@code storedb.tx.retries.exhausted}: transactions abandoned after the last attempt conflicted</li>
 *   <li>{@code storedb.query.slow} (tag {@code type}): queries slower than the slow-query threshold</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code storedb.query.duration} (tag {@code type}): duration of every query primitive</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * Registered only after {@link #bindPoolStats(Supplier)}: {@code storedb.pool.max},
 * {@code storedb.pool.total}, {@code storedb.pool.active}, {@code storedb.pool.idle} and
 * {@code storedb.pool.awaiting}.
 *
 * @see DatabaseMetrics
 */
public final class MicrometerDatabaseMetrics implements DatabaseMetrics, AutoCloseable {
  public static final String DEFAULT_NAME_PREFIX = "storedb";

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter retries;
  private final Counter retriesExhausted;
  private final Map<String, Timer> queryTimers = new ConcurrentHashMap<>();
  private final Map<String, Counter> slowQueries = new ConcurrentHashMap<>();
  private final List<Meter> poolGauges = new CopyOnWriteArrayList<>();
  private volatile boolean closed;

  public MicrometerDatabaseMetrics(MeterRegistry registry) {
    this(registry, DEFAULT_NAME_PREFIX);
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "registry.storedb"})
   */
  public MicrometerDatabaseMetrics(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.retries = Counter.builder(namePrefix + ".tx.retries")
        .description("Transaction attempts restarted after a serialization conflict")
        .register(registry);
    this.retriesExhausted = Counter.builder(namePrefix + ".tx.retries.exhausted")
        .description("Transactions that conflicted on every attempt")
        .register(registry);
  }

  @Override
  public void incrementTransactionRetry() {
    if (closed) return;
    retries.increment();
  }

  @Override
  public void incrementRetriesExhausted() {
    if (closed) return;
    retriesExhausted.increment();
  }

  @Override
  public void recordQueryDurationMs(String kind, long durationMs) {
    if (closed) return;
    queryTimers.computeIfAbsent(kind, k -> Timer.builder(namePrefix + ".query.duration")
            .description("Duration of database query primitives")
            .tag("type", k)
            .register(registry))
        .record(Duration.ofMillis(durationMs));
  }

  @Override
  public void incrementSlowQuery(String kind) {
    if (closed) return;
    slowQueries.computeIfAbsent(kind, k -> Counter.builder(namePrefix + ".query.slow")
            .description("Queries slower than the slow-query threshold")
            .tag("type", k)
            .register(registry))
        .increment();
  }

  /**
   * Exposes connection pool statistics as gauges. Unavailable statistics read as -1.
   *
   * @param stats usually {@code database::stats}
   */
  public void bindPoolStats(Supplier<PoolStats> stats) {
    Objects.requireNonNull(stats, "stats");
    if (closed) {
      throw new IllegalStateException("metrics already closed");
    }
    poolGauge("max", "Configured pool capacity", stats, PoolStats::maxPoolSize);
    poolGauge("total", "Open connections", stats, PoolStats::total);
    poolGauge("active", "Connections in use", stats, PoolStats::active);
    poolGauge("idle", "Idle connections", stats, PoolStats::idle);
    poolGauge("awaiting", "Threads waiting for a connection", stats, PoolStats::awaiting);
  }

  private void poolGauge(String name, String description, Supplier<PoolStats> stats,
      ToIntFunction<PoolStats> field) {
    poolGauges.add(Gauge.builder(namePrefix + ".pool." + name, stats, s -> field.applyAsInt(s.get()))
        .description(description)
        .strongReference(true)
        .register(registry));
  }

  /**
   * Removes all meters registered by this instance from the registry. Call it when the
   * database is closed so stale gauges do not keep the pool reachable.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>();
    meters.add(retries);
    meters.add(retriesExhausted);
    meters.addAll(queryTimers.values());
    meters.addAll(slowQueries.values());
    meters.addAll(poolGauges);
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    queryTimers.clear();
    slowQueries.clear();
    poolGauges.clear();
    if (first != null) throw first;
  }
}
