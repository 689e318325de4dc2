package logfanout.util;

import logfanout.LogEntry;

import java.util.List;
import java.util.Map;

/**
 * Encodes log entries as JSON for syslog message bodies and HTTP batches.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no external dependencies.
 * Field values are rendered by type: strings, numbers, booleans, maps, collections and
 * arrays natively; {@link java.time.Instant} as ISO-8601; anything else via
 * {@link String#valueOf(Object)}.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  /**
   * Returns the default singleton implementation.
   *
   * @return the default {@link JsonCodec}
   */
  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes one entry as {@code {"timestamp":..,"level":..,"message":..,"fields":{..}}}.
   * {@code fields} is omitted when empty; the timestamp is RFC 3339 in UTC with
   * nanosecond precision where present.
   *
   * @param entry the entry
   * @return JSON object text
   */
  String toJson(LogEntry entry);

  /**
   * Encodes entries as a JSON array of {@link #toJson(LogEntry)} objects.
   *
   * @param entries the entries, in order
   * @return JSON array text
   */
  String toJsonArray(List<LogEntry> entries);

  /**
   * Encodes a string-keyed map as a JSON object.
   *
   * @param values the map; null or empty yields {@code {}}
   * @return JSON object text
   */
  String toJson(Map<String, ?> values);
}
