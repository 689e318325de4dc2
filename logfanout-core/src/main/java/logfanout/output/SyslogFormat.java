package logfanout.output;

import logfanout.LogEntry;
import logfanout.util.JsonCodec;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Syslog line formats. Every rendered frame ends with a newline.
 */
public enum SyslogFormat {

  /**
   * BSD syslog: {@code <pri>Mmm dd hh:mm:ss tag[pid]: {json entry}}.
   */
  RFC3164("rfc3164") {
    @Override
    String render(int priority, LogEntry entry, String tag, JsonCodec codec) {
      return "<" + priority + ">"
          + RFC3164_TIME.format(entry.timestamp().atZone(ZoneId.systemDefault()))
          + ' ' + tag + '[' + ProcessInfo.PID + "]: "
          + codec.toJson(entry) + '\n';
    }
  },

  /**
   * Structured syslog:
   * {@code <pri>1 timestamp hostname app-name procid msgid structured-data {json}}.
   * The entry's fields become structured data under {@code tag@0}; an {@code action}
   * field doubles as the MSGID.
   */
  RFC5424("rfc5424") {
    @Override
    String render(int priority, LogEntry entry, String tag, JsonCodec codec) {
      Object action = entry.fields().get("action");
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("level", entry.level().value());
      body.put("message", entry.message());
      body.put("fields", entry.fields());
      String appName = tag.isEmpty() ? NIL : tag;
      return "<" + priority + ">1 "
          + RFC5424_TIME.format(entry.timestamp().atZone(ZoneId.systemDefault()))
          + ' ' + ProcessInfo.HOSTNAME
          + ' ' + appName
          + ' ' + ProcessInfo.PID
          + ' ' + (action == null ? NIL : String.valueOf(action))
          + ' ' + structuredData(appName, entry.fields())
          + ' ' + codec.toJson(body) + '\n';
    }
  };

  private static final String NIL = "-";
  private static final DateTimeFormatter RFC3164_TIME =
      DateTimeFormatter.ofPattern("MMM ppd HH:mm:ss", Locale.ENGLISH);
  private static final DateTimeFormatter RFC5424_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX", Locale.ENGLISH);

  private final String value;

  SyslogFormat(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  abstract String render(int priority, LogEntry entry, String tag, JsonCodec codec);

  /**
   * Resolves a stored format name; empty or unknown names fall back to {@link #RFC3164}.
   *
   * @param value format name
   * @return the format
   */
  public static SyslogFormat fromValue(String value) {
    if (value != null && RFC5424.value.equalsIgnoreCase(value.trim())) {
      return RFC5424;
    }
    return RFC3164;
  }

  static String structuredData(String sdId, Map<String, Object> fields) {
    if (fields.isEmpty()) {
      return NIL;
    }
    StringBuilder sb = new StringBuilder();
    sb.append('[').append(sdId).append("@0");
    for (Map.Entry<String, Object> field : new TreeMap<>(fields).entrySet()) {
      sb.append(' ').append(field.getKey()).append("=\"");
      escapeParam(sb, String.valueOf(field.getValue()));
      sb.append('"');
    }
    return sb.append(']').toString();
  }

  private static void escapeParam(StringBuilder sb, String value) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '\\' || c == '"' || c == ']') {
        sb.append('\\');
      }
      sb.append(c);
    }
  }

  private static final class ProcessInfo {
    static final long PID = ProcessHandle.current().pid();
    static final String HOSTNAME = resolveHostname();

    private static String resolveHostname() {
      try {
        String name = InetAddress.getLocalHost().getHostName();
        return name == null || name.isEmpty() ? NIL : name;
      } catch (UnknownHostException e) {
        return NIL;
      }
    }
  }
}
