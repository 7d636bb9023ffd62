package storedb.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import storedb.ConflictClassifier;
import storedb.Database;
import storedb.OperationContext;
import storedb.PoolStats;
import storedb.RetryPolicy;
import storedb.RowMapper;
import storedb.Rows;
import storedb.TxFunction;
import storedb.TxOption;
import storedb.TxOptions;
import storedb.spi.ConnectionProvider;
import storedb.spi.DatabaseMetrics;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link Database} facade over a pooled {@link DataSource}.
 *
 * <p>Direct queries borrow a connection per call in auto-commit mode. Transactional work
 * goes through a shared {@link TransactionExecutor}. Every query primitive is timed, and
 * calls slower than the slow-query threshold are logged with their arguments.
 *
 * <p>Create instances via {@link #builder()}. {@link #withContext(OperationContext)}
 * derives facades that share the pool and the executor but nothing mutable.
 *
 * <pre>{@code
 * Database db = JdbcDatabase.builder().dataSource(hikari).build();
 * long id = db.execute(tx -> {
 *   tx.exec("UPDATE branches SET head = ? WHERE id = ?", head, branchId);
 *   return branchId;
 * });
 * }</pre>
 */
public final class JdbcDatabase implements Database {
  static final String PG_SETTINGS_QUERY = "SELECT name, setting FROM pg_settings"
      + " WHERE name IN ('data_directory', 'rds.extensions', 'TimeZone', 'work_mem')";

  private final DataSource dataSource;
  private final ConnectionProvider connectionProvider;
  private final TransactionExecutor executor;
  private final Logger logger;
  private final OperationContext context;
  private final Duration slowQueryThreshold;
  private final DatabaseMetrics metrics;
  private final boolean closeDataSource;
  private final QueryInstrumentation instrumentation;

  private JdbcDatabase(Builder builder) {
    this.dataSource = Objects.requireNonNull(builder.dataSource, "dataSource");
    this.connectionProvider = new DataSourceConnectionProvider(dataSource);
    this.metrics = builder.metrics != null ? builder.metrics : DatabaseMetrics.NOOP;
    this.slowQueryThreshold = builder.slowQueryThreshold != null
        ? builder.slowQueryThreshold : QueryInstrumentation.DEFAULT_SLOW_QUERY_THRESHOLD;
    if (slowQueryThreshold.isNegative()) {
      throw new IllegalArgumentException("slowQueryThreshold must be >= 0");
    }
    this.logger = builder.logger != null ? builder.logger : LoggerFactory.getLogger(JdbcDatabase.class);
    this.context = OperationContext.background();
    this.closeDataSource = builder.closeDataSource;
    this.executor = TransactionExecutor.builder()
        .connectionProvider(connectionProvider)
        .retryPolicy(builder.retryPolicy)
        .conflictClassifier(builder.conflictClassifier)
        .metrics(metrics)
        .sleeper(builder.sleeper)
        .slowQueryThreshold(slowQueryThreshold)
        .build();
    this.instrumentation = new QueryInstrumentation(logger, context, slowQueryThreshold, metrics);
  }

  private JdbcDatabase(JdbcDatabase origin, OperationContext context) {
    this.dataSource = origin.dataSource;
    this.connectionProvider = origin.connectionProvider;
    this.executor = origin.executor;
    this.logger = origin.logger;
    this.context = context;
    this.slowQueryThreshold = origin.slowQueryThreshold;
    this.metrics = origin.metrics;
    this.closeDataSource = origin.closeDataSource;
    this.instrumentation = new QueryInstrumentation(logger, context, slowQueryThreshold, metrics);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public JdbcDatabase withContext(OperationContext context) {
    Objects.requireNonNull(context, "context");
    return new JdbcDatabase(this, context);
  }

  /**
   * The context this facade's calls run under; {@link OperationContext#background()}
   * unless derived with {@link #withContext(OperationContext)}.
   */
  public OperationContext context() {
    return context;
  }

  @Override
  public <T> Optional<T> get(RowMapper<T> mapper, String sql, Object... args) throws SQLException {
    return withConnection(QueryKind.GET, sql, args,
        conn -> JdbcTemplate.queryFirst(conn, context, mapper, sql, args));
  }

  @Override
  public <T> List<T> select(RowMapper<T> mapper, String sql, Object... args) throws SQLException {
    return withConnection(QueryKind.SELECT, sql, args,
        conn -> JdbcTemplate.query(conn, context, mapper, sql, args));
  }

  @Override
  public Rows query(String sql, Object... args) throws SQLException {
    return instrumentation.run(QueryKind.QUERY, sql, args, () -> {
      Connection conn = borrow();
      try {
        return JdbcTemplate.open(conn, context, true, sql, args);
      } catch (SQLException | RuntimeException e) {
        try {
          conn.close();
        } catch (SQLException closeError) {
          e.addSuppressed(closeError);
        }
        throw e;
      }
    });
  }

  @Override
  public long exec(String sql, Object... args) throws SQLException {
    return withConnection(QueryKind.EXEC, sql, args,
        conn -> JdbcTemplate.update(conn, context, sql, args));
  }

  /**
   * Runs {@code fn} in a transaction. Defaults to serializable isolation, this facade's
   * logger and this facade's context; {@code options} override them in order.
   */
  @Override
  public <T> T execute(TxFunction<T> fn, TxOption... options) throws SQLException {
    TxOptions txOptions = TxOptions.builder()
        .logger(logger)
        .context(context)
        .apply(options)
        .build();
    return executor.execute(fn, txOptions);
  }

  /**
   * Collects PostgreSQL server metadata: {@code postgresql_version},
   * {@code postgresql_aurora_version} and {@code postgresql_setting_*} entries
   * ({@code data_directory} is reported as {@code postgresql_setting_is_rds}).
   * Each part is read in its own read-only transaction and left out if it fails.
   */
  @Override
  public Map<String, String> metadata() {
    Map<String, String> metadata = new LinkedHashMap<>();
    scalar("SELECT version()").ifPresent(v -> metadata.put("postgresql_version", v));
    scalar("SELECT aurora_version()").ifPresent(v -> metadata.put("postgresql_aurora_version", v));

    Map<String, String> settings;
    try {
      settings = execute(tx -> {
        Map<String, String> found = new LinkedHashMap<>();
        List<String[]> rows = tx.select(rs -> new String[] {rs.getString("name"), rs.getString("setting")},
            PG_SETTINGS_QUERY);
        for (String[] row : rows) {
          if ("data_directory".equals(row[0])) {
            boolean isRds = row[1] != null && row[1].startsWith("/rdsdata");
            found.put("is_rds", Boolean.toString(isRds));
            continue;
          }
          found.put(row[0], row[1]);
        }
        return found;
      }, TxOption.readOnly());
    } catch (SQLException e) {
      logger.atDebug().setCause(e).log("pg_settings unavailable, skipping in metadata");
      return metadata;
    }
    settings.forEach((name, value) -> metadata.put("postgresql_setting_" + name, value));
    return metadata;
  }

  private Optional<String> scalar(String sql) {
    try {
      return execute(tx -> tx.get(rs -> rs.getString(1), sql), TxOption.readOnly(), TxOption.silent());
    } catch (SQLException e) {
      logger.atDebug().addKeyValue("query", sql).setCause(e).log("metadata query failed, skipping");
      return Optional.empty();
    }
  }

  /**
   * Reads HikariCP pool statistics; {@link PoolStats#UNAVAILABLE} for other data sources
   * or before the pool has started.
   */
  @Override
  public PoolStats stats() {
    if (dataSource instanceof HikariDataSource hikari) {
      HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
      if (pool == null) {
        return PoolStats.UNAVAILABLE;
      }
      return new PoolStats(hikari.getMaximumPoolSize(), pool.getTotalConnections(),
          pool.getActiveConnections(), pool.getIdleConnections(), pool.getThreadsAwaitingConnection());
    }
    return PoolStats.UNAVAILABLE;
  }

  /**
   * Closes the HikariCP pool unless the builder was told the pool is managed elsewhere.
   * Facades derived with {@link #withContext} share the pool, so closing any of them
   * closes it for all.
   */
  @Override
  public void close() {
    if (closeDataSource && dataSource instanceof HikariDataSource hikari) {
      hikari.close();
    }
  }

  private Connection borrow() throws SQLException {
    Connection conn = connectionProvider.getConnection();
    try {
      conn.setAutoCommit(true);
      return conn;
    } catch (SQLException | RuntimeException e) {
      try {
        conn.close();
      } catch (SQLException closeError) {
        e.addSuppressed(closeError);
      }
      throw e;
    }
  }

  private <T> T withConnection(QueryKind kind, String sql, Object[] args, ConnectionCallback<T> callback)
      throws SQLException {
    return instrumentation.run(kind, sql, args, () -> {
      try (Connection conn = borrow()) {
        return callback.apply(conn);
      }
    });
  }

  @FunctionalInterface
  private interface ConnectionCallback<T> {
    T apply(Connection conn) throws SQLException;
  }

  /**
   * Builder for {@link JdbcDatabase}.
   */
  public static final class Builder {
    private DataSource dataSource;
    private RetryPolicy retryPolicy;
    private ConflictClassifier conflictClassifier;
    private DatabaseMetrics metrics;
    private Sleeper sleeper;
    private Duration slowQueryThreshold;
    private Logger logger;
    private boolean closeDataSource = true;

    private Builder() {
    }

    /**
     * Sets the pooled data source, typically a {@link HikariDataSource}.
     *
     * <p><b>Required.</b>
     */
    public Builder dataSource(DataSource dataSource) {
      this.dataSource = dataSource;
      return this;
    }

    /**
     * Sets the conflict retry budget and backoff unit.
     *
     * <p>Optional. Defaults to {@link RetryPolicy#defaults()}.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Optional. Defaults to {@link SqlStateConflictClassifier#INSTANCE}.
     */
    public Builder conflictClassifier(ConflictClassifier conflictClassifier) {
      this.conflictClassifier = conflictClassifier;
      return this;
    }

    /**
     * Optional. Defaults to {@link DatabaseMetrics#NOOP}.
     */
    public Builder metrics(DatabaseMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets how the executor waits between attempts.
     *
     * <p>Optional. Defaults to {@link Sleeper#THREAD}.
     */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * Sets the duration above which a query is logged.
     *
     * <p>Optional. Defaults to 100ms. Must be &ge; 0.
     */
    public Builder slowQueryThreshold(Duration slowQueryThreshold) {
      this.slowQueryThreshold = slowQueryThreshold;
      return this;
    }

    /**
     * Sets the logger for slow queries and retry warnings.
     *
     * <p>Optional. Defaults to the {@code storedb.jdbc.JdbcDatabase} logger.
     */
    public Builder logger(Logger logger) {
      this.logger = logger;
      return this;
    }

    /**
     * Whether {@link JdbcDatabase#close()} closes the pool. Set to {@code false} when the
     * pool's lifecycle is managed elsewhere, e.g. by Spring.
     *
     * <p>Optional. Defaults to {@code true}.
     */
    public Builder closeDataSource(boolean closeDataSource) {
      this.closeDataSource = closeDataSource;
      return this;
    }

    public JdbcDatabase build() {
      return new JdbcDatabase(this);
    }
  }
}
