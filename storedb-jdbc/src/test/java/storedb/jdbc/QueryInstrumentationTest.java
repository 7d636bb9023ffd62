package storedb.jdbc;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import storedb.OperationContext;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class QueryInstrumentationTest {
  private final LogCapture logs = LogCapture.create();
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final AtomicLong clock = new AtomicLong();

  @AfterEach
  void tearDown() {
    logs.close();
  }

  @Test
  void fastQueryIsNotLoggedButIsMeasured() throws Exception {
    QueryInstrumentation instrumentation = instrumentation(OperationContext.background(), Duration.ofMillis(100));

    long affected = instrumentation.run(QueryKind.EXEC, "DELETE FROM blobs WHERE id = ?", new Object[] {7L},
        () -> {
          clock.addAndGet(Duration.ofMillis(5).toNanos());
          return 1L;
        });

    assertEquals(1L, affected);
    assertTrue(logs.events().isEmpty());
    assertEquals(List.of("exec"), metrics.queryKinds);
    assertTrue(metrics.slowQueryKinds.isEmpty());
  }

  @Test
  void queryExactlyAtThresholdIsNotLogged() throws Exception {
    QueryInstrumentation instrumentation = instrumentation(OperationContext.background(), Duration.ofMillis(100));

    instrumentation.run(QueryKind.GET, "SELECT 1", new Object[0], () -> {
      clock.addAndGet(Duration.ofMillis(100).toNanos());
      return null;
    });

    assertTrue(logs.events().isEmpty());
  }

  @Test
  void slowQueryLogsOneInfoEntryWithFields() throws Exception {
    OperationContext ctx = OperationContext.background().withField("request_id", "req-9");
    QueryInstrumentation instrumentation = instrumentation(ctx, Duration.ofMillis(100));

    instrumentation.run(QueryKind.SELECT, "SELECT * FROM manifests WHERE repo = ?", new Object[] {"library/app"},
        () -> {
          clock.addAndGet(Duration.ofMillis(250).toNanos());
          return List.of();
        });

    List<ILoggingEvent> events = logs.events("database done");
    assertEquals(1, events.size());
    assertEquals(Level.INFO, events.get(0).getLevel());
    Map<String, Object> fields = LogCapture.keyValues(events.get(0));
    assertEquals("req-9", fields.get("request_id"));
    assertEquals("select", fields.get("type"));
    assertEquals("SELECT * FROM manifests WHERE repo = ?", fields.get("query"));
    assertEquals(List.of("library/app"), fields.get("args"));
    assertEquals(Duration.ofMillis(250), fields.get("duration"));
    assertFalse(fields.containsKey("error"));
    assertEquals(List.of("select"), metrics.slowQueryKinds);
  }

  @Test
  void slowFailureIsLoggedWithErrorAndRethrown() {
    QueryInstrumentation instrumentation = instrumentation(OperationContext.background(), Duration.ZERO);
    SQLException failure = new SQLException("relation \"tags\" does not exist", "42P01");

    SQLException thrown = assertThrows(SQLException.class,
        () -> instrumentation.run(QueryKind.QUERY, "SELECT * FROM tags", null, () -> {
          clock.addAndGet(1);
          throw failure;
        }));

    assertSame(failure, thrown);
    Map<String, Object> fields = LogCapture.keyValues(logs.events("database done").get(0));
    assertEquals("start query", fields.get("type"));
    assertEquals(failure.toString(), fields.get("error"));
    assertNull(fields.get("args"));
  }

  @Test
  void fastFailureIsMeasuredOnly() {
    QueryInstrumentation instrumentation = instrumentation(OperationContext.background(), Duration.ofSeconds(1));

    assertThrows(IllegalStateException.class,
        () -> instrumentation.run(QueryKind.EXEC, "UPDATE uploads SET done = true", new Object[0], () -> {
          throw new IllegalStateException("Transaction already finished");
        }));

    assertTrue(logs.events().isEmpty());
    assertEquals(List.of("exec"), metrics.queryKinds);
  }

  private QueryInstrumentation instrumentation(OperationContext ctx, Duration threshold) {
    return new QueryInstrumentation(logs.logger(), ctx, threshold, metrics, clock::get);
  }
}
