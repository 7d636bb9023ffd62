package storedb.jdbc;

import org.slf4j.Logger;
import org.slf4j.spi.LoggingEventBuilder;
import storedb.OperationContext;
import storedb.spi.DatabaseMetrics;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Wraps every query primitive with duration reporting. The duration always goes to
 * {@link DatabaseMetrics}; a {@code database done} log entry is emitted only when the
 * call took longer than the slow-query threshold.
 */
final class QueryInstrumentation {
  static final Duration DEFAULT_SLOW_QUERY_THRESHOLD = Duration.ofMillis(100);

  @FunctionalInterface
  interface SqlCall<T> {
    T call() throws SQLException;
  }

  private final Logger logger;
  private final OperationContext context;
  private final Duration slowQueryThreshold;
  private final DatabaseMetrics metrics;
  private final LongSupplier nanoClock;

  QueryInstrumentation(Logger logger, OperationContext context, Duration slowQueryThreshold,
      DatabaseMetrics metrics) {
    this(logger, context, slowQueryThreshold, metrics, System::nanoTime);
  }

  QueryInstrumentation(Logger logger, OperationContext context, Duration slowQueryThreshold,
      DatabaseMetrics metrics, LongSupplier nanoClock) {
    this.logger = Objects.requireNonNull(logger, "logger");
    this.context = Objects.requireNonNull(context, "context");
    this.slowQueryThreshold = Objects.requireNonNull(slowQueryThreshold, "slowQueryThreshold");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
  }

  <T> T run(QueryKind kind, String sql, Object[] args, SqlCall<T> call) throws SQLException {
    long start = nanoClock.getAsLong();
    Throwable failure = null;
    try {
      return call.call();
    } catch (SQLException | RuntimeException e) {
      failure = e;
      throw e;
    } finally {
      reportFinish(kind, sql, args, Duration.ofNanos(nanoClock.getAsLong() - start), failure);
    }
  }

  private void reportFinish(QueryKind kind, String sql, Object[] args, Duration duration, Throwable failure) {
    metrics.recordQueryDurationMs(kind.label(), duration.toMillis());
    if (duration.compareTo(slowQueryThreshold) <= 0) {
      return;
    }
    metrics.incrementSlowQuery(kind.label());
    LoggingEventBuilder event = LogFields.withContext(logger.atInfo(), context)
        .addKeyValue("type", kind.label())
        .addKeyValue("query", sql)
        .addKeyValue("args", args == null ? null : Arrays.asList(args))
        .addKeyValue("duration", duration);
    if (failure != null) {
      event = event.addKeyValue("error", failure.toString());
    }
    event.log("database done");
  }
}
