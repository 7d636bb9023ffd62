package storedb.jdbc;

import ch.qos.logback.classic.spi.ILoggingEvent;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import storedb.OperationCancelledException;
import storedb.OperationContext;
import storedb.PoolStats;
import storedb.RowMapper;
import storedb.Rows;
import storedb.TxOption;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class JdbcDatabaseTest {
  private static final RowMapper<Blob> BLOB = rs -> new Blob(rs.getString("digest"), rs.getLong("size"));

  private JdbcDataSource dataSource;
  private LogCapture logs;
  private RecordingMetrics metrics;
  private JdbcDatabase db;

  @BeforeEach
  void setUp() throws Exception {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:storedb_" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
    logs = LogCapture.create();
    metrics = new RecordingMetrics();
    db = JdbcDatabase.builder()
        .dataSource(dataSource)
        .logger(logs.logger())
        .metrics(metrics)
        .slowQueryThreshold(Duration.ofMinutes(1))
        .build();
    db.exec("CREATE TABLE blobs (digest VARCHAR(64) PRIMARY KEY, size BIGINT NOT NULL)");
  }

  @AfterEach
  void tearDown() throws Exception {
    db.exec("DROP ALL OBJECTS");
    db.close();
    logs.close();
  }

  @Test
  void builderRequiresDataSource() {
    assertThrows(NullPointerException.class, () -> JdbcDatabase.builder().build());
  }

  @Test
  void builderRejectsNegativeSlowQueryThreshold() {
    assertThrows(IllegalArgumentException.class,
        () -> JdbcDatabase.builder().dataSource(dataSource).slowQueryThreshold(Duration.ofMillis(-1)).build());
  }

  @Test
  void execGetAndSelect() throws Exception {
    assertEquals(1, db.exec("INSERT INTO blobs (digest, size) VALUES (?, ?)", "sha256:aa", 10L));
    assertEquals(1, db.exec("INSERT INTO blobs (digest, size) VALUES (?, ?)", "sha256:bb", 20L));

    assertEquals(Optional.of(new Blob("sha256:aa", 10)),
        db.get(BLOB, "SELECT digest, size FROM blobs WHERE digest = ?", "sha256:aa"));
    assertEquals(Optional.empty(), db.get(BLOB, "SELECT digest, size FROM blobs WHERE digest = ?", "sha256:zz"));
    assertEquals(List.of(new Blob("sha256:aa", 10), new Blob("sha256:bb", 20)),
        db.select(BLOB, "SELECT digest, size FROM blobs ORDER BY digest"));
    assertEquals(2, db.exec("UPDATE blobs SET size = size + 1"));
  }

  @Test
  void queryStreamsRowsUntilClosed() throws Exception {
    insert("sha256:aa", 1);
    insert("sha256:bb", 2);

    List<String> digests = new ArrayList<>();
    Rows rows = db.query("SELECT digest, size FROM blobs ORDER BY digest");
    try (rows) {
      while (rows.next()) {
        digests.add(rows.map(rs -> rs.getString(1)));
      }
    }

    assertEquals(List.of("sha256:aa", "sha256:bb"), digests);
    SQLException closed = assertThrows(SQLException.class, rows::next);
    assertEquals("Rows already closed", closed.getMessage());
  }

  @Test
  void executeCommitsWork() throws Exception {
    long size = db.execute(tx -> {
      tx.exec("INSERT INTO blobs (digest, size) VALUES (?, ?)", "sha256:cc", 30L);
      return tx.get(rs -> rs.getLong(1), "SELECT size FROM blobs WHERE digest = ?", "sha256:cc").orElseThrow();
    });

    assertEquals(30L, size);
    assertTrue(db.get(BLOB, "SELECT digest, size FROM blobs WHERE digest = ?", "sha256:cc").isPresent());
  }

  @Test
  void executeRollsBackOnFailure() throws Exception {
    SQLException failure = new SQLException("manifest references unknown blob", "23503");

    SQLException thrown = assertThrows(SQLException.class, () -> db.execute(tx -> {
      tx.exec("INSERT INTO blobs (digest, size) VALUES (?, ?)", "sha256:dd", 40L);
      throw failure;
    }));

    assertSame(failure, thrown);
    assertTrue(db.select(BLOB, "SELECT digest, size FROM blobs").isEmpty());
  }

  @Test
  void executeAppliesReadOnlyOption() throws Exception {
    boolean readOnly = db.execute(tx -> tx.options().readOnly(), TxOption.readOnly());
    boolean readWrite = !db.execute(tx -> tx.options().readOnly());

    assertTrue(readOnly);
    assertTrue(readWrite);
  }

  @Test
  void rowsLeftOpenByFunctionAreClosedAtCommit() throws Exception {
    insert("sha256:ee", 5);
    AtomicReference<Rows> leaked = new AtomicReference<>();

    db.execute(tx -> {
      leaked.set(tx.query("SELECT digest FROM blobs"));
      return null;
    });

    assertThrows(SQLException.class, () -> leaked.get().next());
  }

  @Test
  void withContextLeavesOriginalUntouched() throws Exception {
    OperationContext ctx = OperationContext.background().withCancel();
    JdbcDatabase scoped = db.withContext(ctx);
    ctx.cancel();

    assertNotSame(db, scoped);
    assertSame(ctx, scoped.context());
    assertSame(OperationContext.background(), db.context());
    assertThrows(OperationCancelledException.class, () -> scoped.exec("DELETE FROM blobs"));
    assertThrows(OperationCancelledException.class, () -> scoped.execute(tx -> 1));
    assertEquals(0, db.exec("DELETE FROM blobs"));
  }

  @Test
  void expiredDeadlineFailsBeforeAnyAttempt() {
    JdbcDatabase scoped = db.withContext(OperationContext.background().withTimeout(Duration.ZERO));

    OperationCancelledException thrown = assertThrows(OperationCancelledException.class,
        () -> scoped.execute(tx -> tx.exec("DELETE FROM blobs")));
    assertEquals("context deadline exceeded", thrown.getMessage());
  }

  @Test
  void contextOptionOverridesFacadeContext() throws Exception {
    OperationContext cancelled = OperationContext.background().withCancel();
    cancelled.cancel();

    assertThrows(OperationCancelledException.class,
        () -> db.execute(tx -> 1, TxOption.withContext(cancelled)));
  }

  @Test
  void slowQueriesAreLoggedWithContextFields() throws Exception {
    JdbcDatabase slow = JdbcDatabase.builder()
        .dataSource(dataSource)
        .logger(logs.logger())
        .metrics(metrics)
        .slowQueryThreshold(Duration.ZERO)
        .build()
        .withContext(OperationContext.background().withField("repository", "library/app"));

    slow.exec("INSERT INTO blobs (digest, size) VALUES (?, ?)", "sha256:ff", 6L);
    slow.execute(tx -> tx.get(BLOB, "SELECT digest, size FROM blobs WHERE digest = ?", "sha256:ff"));

    List<ILoggingEvent> events = logs.events("database done");
    assertEquals(2, events.size());
    Map<String, Object> exec = LogCapture.keyValues(events.get(0));
    assertEquals("exec", exec.get("type"));
    assertEquals("library/app", exec.get("repository"));
    assertEquals(List.of("sha256:ff", 6L), exec.get("args"));
    assertEquals("get", LogCapture.keyValues(events.get(1)).get("type"));
    assertEquals("library/app", LogCapture.keyValues(events.get(1)).get("repository"));
  }

  @Test
  void fastQueriesAreNotLogged() throws Exception {
    JdbcDatabase quiet = JdbcDatabase.builder()
        .dataSource(dataSource)
        .logger(logs.logger())
        .slowQueryThreshold(Duration.ofMinutes(1))
        .build();

    quiet.exec("INSERT INTO blobs (digest, size) VALUES (?, ?)", "sha256:gg", 7L);

    assertTrue(logs.events().isEmpty());
  }

  @Test
  void queryDurationsAreReportedPerKind() throws Exception {
    insert("sha256:hh", 8);
    db.get(BLOB, "SELECT digest, size FROM blobs");
    db.select(BLOB, "SELECT digest, size FROM blobs");

    assertEquals(List.of("exec", "exec", "get", "select"), metrics.queryKinds);
  }

  @Test
  void metadataReadsPgSettings() throws Exception {
    db.exec("CREATE TABLE pg_settings (name VARCHAR(64), setting VARCHAR(255))");
    db.exec("INSERT INTO pg_settings VALUES ('data_directory', '/rdsdata/db'), ('TimeZone', 'UTC'),"
        + " ('work_mem', '4MB'), ('max_connections', '100')");

    Map<String, String> metadata = db.metadata();

    assertEquals("true", metadata.get("postgresql_setting_is_rds"));
    assertEquals("UTC", metadata.get("postgresql_setting_TimeZone"));
    assertEquals("4MB", metadata.get("postgresql_setting_work_mem"));
    assertFalse(metadata.containsKey("postgresql_setting_max_connections"));
    assertFalse(metadata.containsKey("postgresql_setting_data_directory"));
    assertFalse(metadata.containsKey("postgresql_aurora_version"));
  }

  @Test
  void metadataLogsSettingsQueryButNotVersionProbes() throws Exception {
    db.exec("CREATE TABLE pg_settings (name VARCHAR(64), setting VARCHAR(255))");
    db.exec("INSERT INTO pg_settings VALUES ('TimeZone', 'UTC')");
    try (JdbcDatabase everyQuerySlow = JdbcDatabase.builder()
        .dataSource(dataSource)
        .logger(logs.logger())
        .slowQueryThreshold(Duration.ZERO)
        .build()) {
      everyQuerySlow.metadata();
    }

    List<Object> queries = logs.events("database done").stream()
        .map(e -> LogCapture.keyValues(e).get("query"))
        .toList();
    assertTrue(queries.contains(JdbcDatabase.PG_SETTINGS_QUERY));
    assertFalse(queries.contains("SELECT version()"));
    assertFalse(queries.contains("SELECT aurora_version()"));
  }

  @Test
  void metadataOnSelfHostedDataDirectory() throws Exception {
    db.exec("CREATE TABLE pg_settings (name VARCHAR(64), setting VARCHAR(255))");
    db.exec("INSERT INTO pg_settings VALUES ('data_directory', '/var/lib/postgresql/data')");

    assertEquals("false", db.metadata().get("postgresql_setting_is_rds"));
  }

  @Test
  void metadataSkipsWhatTheServerCannotAnswer() {
    Map<String, String> metadata = assertDoesNotThrow(() -> db.metadata());

    assertTrue(metadata.keySet().stream().noneMatch(k -> k.startsWith("postgresql_setting_")));
    assertFalse(metadata.containsKey("postgresql_aurora_version"));
  }

  @Test
  void statsUnavailableWithoutHikari() {
    PoolStats stats = db.stats();

    assertSame(PoolStats.UNAVAILABLE, stats);
    assertFalse(stats.isAvailable());
  }

  private void insert(String digest, long size) throws SQLException {
    db.exec("INSERT INTO blobs (digest, size) VALUES (?, ?)", digest, size);
  }

  record Blob(String digest, long size) {}
}
