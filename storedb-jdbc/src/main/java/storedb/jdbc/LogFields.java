package storedb.jdbc;

import org.slf4j.spi.LoggingEventBuilder;
import storedb.OperationContext;

import java.util.Map;

final class LogFields {

  /** Adds the context's structured fields to a log event. */
  static LoggingEventBuilder withContext(LoggingEventBuilder event, OperationContext context) {
    LoggingEventBuilder decorated = event;
    for (Map.Entry<String, Object> field : context.fields().entrySet()) {
      decorated = decorated.addKeyValue(field.getKey(), field.getValue());
    }
    return decorated;
  }

  private LogFields() {}
}
