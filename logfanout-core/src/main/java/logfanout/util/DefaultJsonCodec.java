package logfanout.util;

import logfanout.LogEntry;

import java.lang.reflect.Array;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Lightweight JSON encoder for log entries. Has no external dependencies.
 *
 * <p>This is the default {@link JsonCodec} implementation, accessible via
 * {@link JsonCodec#getDefault()}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(LogEntry entry) {
    StringBuilder sb = new StringBuilder(128);
    appendEntry(sb, entry);
    return sb.toString();
  }

  @Override
  public String toJsonArray(List<LogEntry> entries) {
    StringBuilder sb = new StringBuilder(128 * Math.max(1, entries.size()));
    sb.append('[');
    for (int i = 0; i < entries.size(); i++) {
      if (i > 0) {
        sb.append(',');
      }
      appendEntry(sb, entries.get(i));
    }
    sb.append(']');
    return sb.toString();
  }

  @Override
  public String toJson(Map<String, ?> values) {
    StringBuilder sb = new StringBuilder();
    appendValue(sb, values == null ? Map.of() : values);
    return sb.toString();
  }

  private static void appendEntry(StringBuilder sb, LogEntry entry) {
    sb.append("{\"timestamp\":");
    appendString(sb, DateTimeFormatter.ISO_INSTANT.format(entry.timestamp()));
    sb.append(",\"level\":");
    appendString(sb, entry.level().value());
    sb.append(",\"message\":");
    appendString(sb, entry.message());
    if (!entry.fields().isEmpty()) {
      sb.append(",\"fields\":");
      appendValue(sb, entry.fields());
    }
    sb.append('}');
  }

  private static void appendValue(StringBuilder sb, Object value) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof CharSequence) {
      appendString(sb, value.toString());
    } else if (value instanceof Boolean) {
      sb.append(value);
    } else if (value instanceof Number) {
      appendNumber(sb, (Number) value);
    } else if (value instanceof Map<?, ?>) {
      sb.append('{');
      boolean first = true;
      for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
        if (!first) {
          sb.append(',');
        }
        first = false;
        appendString(sb, String.valueOf(e.getKey()));
        sb.append(':');
        appendValue(sb, e.getValue());
      }
      sb.append('}');
    } else if (value instanceof Iterable<?>) {
      sb.append('[');
      boolean first = true;
      for (Object item : (Iterable<?>) value) {
        if (!first) {
          sb.append(',');
        }
        first = false;
        appendValue(sb, item);
      }
      sb.append(']');
    } else if (value.getClass().isArray()) {
      sb.append('[');
      int length = Array.getLength(value);
      for (int i = 0; i < length; i++) {
        if (i > 0) {
          sb.append(',');
        }
        appendValue(sb, Array.get(value, i));
      }
      sb.append(']');
    } else if (value instanceof Instant) {
      appendString(sb, DateTimeFormatter.ISO_INSTANT.format((Instant) value));
    } else {
      appendString(sb, String.valueOf(value));
    }
  }

  private static void appendNumber(StringBuilder sb, Number number) {
    if (number instanceof Double || number instanceof Float) {
      double d = number.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        appendString(sb, number.toString());
        return;
      }
    }
    sb.append(number);
  }

  private static void appendString(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    sb.append('"');
  }
}
