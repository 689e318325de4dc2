package logfanout.spi;

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Read access to the host's dynamic settings. Used for host-logger settings
 * ({@code logging.level}, {@code logging.format}, {@code logging.include_caller}) and for
 * the legacy single-target keys migrated into the target store.
 */
public interface SettingsReader {

  /**
   * Returns the raw value of a setting.
   *
   * @param key setting key
   * @return the value, or empty if the setting does not exist
   */
  Optional<String> get(String key);

  /**
   * Returns a setting parsed as an integer. Missing or malformed values are empty.
   *
   * @param key setting key
   * @return the parsed value
   */
  default OptionalInt getInt(String key) {
    Optional<String> raw = get(key);
    if (raw.isEmpty()) {
      return OptionalInt.empty();
    }
    try {
      return OptionalInt.of(Integer.parseInt(raw.get().trim()));
    } catch (NumberFormatException e) {
      return OptionalInt.empty();
    }
  }

  /**
   * Returns a setting parsed as a boolean; {@code "true"} and {@code "1"} are true,
   * every other present value is false.
   *
   * @param key setting key
   * @return the parsed value, or empty if the setting does not exist
   */
  default Optional<Boolean> getBool(String key) {
    return get(key).map(v -> {
      String normalized = v.trim().toLowerCase(Locale.ROOT);
      return "true".equals(normalized) || "1".equals(normalized);
    });
  }
}
