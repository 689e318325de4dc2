package logfanout.dispatch;

import logfanout.LogEntry;
import logfanout.LogLevel;
import logfanout.spi.MetricsExporter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.ErrorManager;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;

/**
 * {@code java.util.logging} handler that fans every record out to the live outputs.
 *
 * <p>The hot path reads the current {@link DispatchSnapshot} from an atomic reference and
 * never takes a lock. Each route whose filter level admits the entry gets it offered to its
 * queue; a full queue drops the entry for that route only. Records from the outputs' own
 * loggers ({@value #INTERNAL_LOGGER_PREFIX}) are not forwarded, so a failing output cannot
 * feed its own errors back into itself.
 *
 * <p>A {@link java.util.Map} among the record parameters becomes the entry's structured
 * fields. The logger name and the thrown exception, if any, are added as the {@code logger}
 * and {@code error} fields.
 */
public final class DispatchHook extends Handler implements WriteFailureListener {
  /** Logger namespace whose records are never dispatched. */
  public static final String INTERNAL_LOGGER_PREFIX = "logfanout.output";

  private static final Formatter MESSAGE_FORMATTER = new SimpleFormatter();

  private final AtomicReference<DispatchSnapshot> snapshot =
      new AtomicReference<>(DispatchSnapshot.EMPTY);
  private final MetricsExporter metrics;

  public DispatchHook(MetricsExporter metrics) {
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    setLevel(Level.ALL);
  }

  @Override
  public void publish(LogRecord record) {
    if (record == null || !isLoggable(record) || isInternal(record.getLoggerName())) {
      return;
    }
    LogEntry entry;
    try {
      entry = toEntry(record);
    } catch (RuntimeException e) {
      reportError("cannot convert log record", e, ErrorManager.FORMAT_FAILURE);
      return;
    }
    fire(entry);
  }

  /**
   * Offers an entry to every route that admits its level. Never blocks.
   *
   * @param entry the entry
   */
  public void fire(LogEntry entry) {
    for (OutputRoute route : snapshot.get().routes()) {
      if (!route.filterLevel().admits(entry.level())) {
        continue;
      }
      if (route.output().offer(entry)) {
        metrics.incrementEnqueued();
      } else {
        metrics.incrementDropped();
      }
    }
  }

  /**
   * Publishes a new set of routes. Entries fired after this returns see the new routes.
   *
   * @param next the snapshot to publish
   */
  public void updateSnapshot(DispatchSnapshot next) {
    snapshot.set(next == null ? DispatchSnapshot.EMPTY : next);
  }

  public DispatchSnapshot snapshot() {
    return snapshot.get();
  }

  @Override
  public void onWriteFailure(String targetId, Exception failure) {
    reportError("failed to write log entry to target " + targetId, failure,
        ErrorManager.WRITE_FAILURE);
  }

  @Override
  public void flush() {
    // outputs flush on their own workers
  }

  /**
   * Detaches all routes. The outputs themselves are owned and closed by the manager.
   */
  @Override
  public void close() {
    snapshot.set(DispatchSnapshot.EMPTY);
  }

  static boolean isInternal(String loggerName) {
    return loggerName != null && loggerName.startsWith(INTERNAL_LOGGER_PREFIX);
  }

  static LogEntry toEntry(LogRecord record) {
    Map<String, Object> fields = new LinkedHashMap<>();
    Object[] params = record.getParameters();
    if (params != null) {
      for (Object param : params) {
        if (param instanceof Map) {
          for (Map.Entry<?, ?> field : ((Map<?, ?>) param).entrySet()) {
            if (field.getKey() != null) {
              fields.put(String.valueOf(field.getKey()), field.getValue());
            }
          }
        }
      }
    }
    if (record.getLoggerName() != null) {
      fields.putIfAbsent("logger", record.getLoggerName());
    }
    if (record.getThrown() != null) {
      fields.putIfAbsent("error", String.valueOf(record.getThrown()));
    }
    Instant timestamp = record.getInstant();
    return new LogEntry(timestamp, LogLevel.fromJul(record.getLevel()),
        MESSAGE_FORMATTER.formatMessage(record), fields);
  }
}
