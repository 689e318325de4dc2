package logfanout.util;

import logfanout.LogLevel;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

/**
 * Single-line JSON formatter for the host's console and file handlers, selected with the
 * {@code logging.format=json} setting.
 *
 * <p>Lines carry {@code timestamp}, {@code level}, {@code message} and {@code logger};
 * {@code caller} is added when caller reporting is on, {@code fields} when a {@link Map}
 * is among the record parameters, and {@code error} when the record has a throwable.
 */
public final class JsonLogFormatter extends Formatter {
  private final boolean includeCaller;
  private final JsonCodec codec;

  public JsonLogFormatter(boolean includeCaller) {
    this(includeCaller, JsonCodec.getDefault());
  }

  public JsonLogFormatter(boolean includeCaller, JsonCodec codec) {
    this.includeCaller = includeCaller;
    this.codec = codec;
  }

  public boolean includeCaller() {
    return includeCaller;
  }

  @Override
  public String format(LogRecord record) {
    Map<String, Object> line = new LinkedHashMap<>();
    line.put("timestamp", DateTimeFormatter.ISO_INSTANT.format(record.getInstant()));
    line.put("level", LogLevel.fromJul(record.getLevel()).value());
    line.put("message", formatMessage(record));
    line.put("logger", record.getLoggerName());
    if (includeCaller && record.getSourceClassName() != null) {
      String method = record.getSourceMethodName();
      line.put("caller", record.getSourceClassName() + (method == null ? "" : "." + method));
    }
    Map<String, Object> fields = fieldsOf(record);
    if (!fields.isEmpty()) {
      line.put("fields", fields);
    }
    if (record.getThrown() != null) {
      StringWriter trace = new StringWriter();
      record.getThrown().printStackTrace(new PrintWriter(trace));
      line.put("error", trace.toString());
    }
    return codec.toJson(line) + System.lineSeparator();
  }

  private static Map<String, Object> fieldsOf(LogRecord record) {
    Object[] params = record.getParameters();
    if (params == null) {
      return Map.of();
    }
    Map<String, Object> fields = new LinkedHashMap<>();
    for (Object param : params) {
      if (param instanceof Map) {
        for (Map.Entry<?, ?> field : ((Map<?, ?>) param).entrySet()) {
          if (field.getKey() != null) {
            fields.put(String.valueOf(field.getKey()), field.getValue());
          }
        }
      }
    }
    return fields;
  }
}
