package logfanout;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable structured log event handed to every matching {@link Output}.
 *
 * <p>Fields are copied on construction and exposed read-only, so a single entry can be
 * shared by outputs running on different threads. Null keys are rejected; null values
 * are kept and rendered as JSON {@code null}.
 */
public final class LogEntry {
  private final Instant timestamp;
  private final LogLevel level;
  private final String message;
  private final Map<String, Object> fields;

  public LogEntry(Instant timestamp, LogLevel level, String message, Map<String, ?> fields) {
    this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    this.level = Objects.requireNonNull(level, "level");
    this.message = message == null ? "" : message;
    if (fields == null || fields.isEmpty()) {
      this.fields = Collections.emptyMap();
    } else {
      Map<String, Object> copy = new LinkedHashMap<>(fields);
      if (copy.containsKey(null)) {
        throw new IllegalArgumentException("fields cannot contain null keys");
      }
      this.fields = Collections.unmodifiableMap(copy);
    }
  }

  /**
   * Creates an entry stamped with the current time.
   *
   * @param level   entry level
   * @param message message text
   * @param fields  structured fields, may be null
   * @return a new entry
   */
  public static LogEntry of(LogLevel level, String message, Map<String, ?> fields) {
    return new LogEntry(Instant.now(), level, message, fields);
  }

  public Instant timestamp() {
    return timestamp;
  }

  public LogLevel level() {
    return level;
  }

  public String message() {
    return message;
  }

  public Map<String, Object> fields() {
    return fields;
  }

  @Override
  public String toString() {
    return "LogEntry{timestamp=" + timestamp + ", level=" + level + ", message='" + message
        + "', fields=" + fields + '}';
  }
}
