package logfanout;

import java.util.Locale;
import java.util.logging.Level;

/**
 * Severity of a {@link LogEntry}, ordered from least to most severe.
 *
 * <p>The same scale is used for target filter levels: a target configured with
 * {@code warn} receives {@code warn}, {@code error}, {@code fatal} and {@code panic}.
 */
public enum LogLevel {
  DEBUG("debug"),
  INFO("info"),
  WARN("warn"),
  ERROR("error"),
  FATAL("fatal"),
  PANIC("panic");

  private final String value;

  LogLevel(String value) {
    this.value = value;
  }

  /** Lower-case wire name, e.g. {@code "warn"}. */
  public String value() {
    return value;
  }

  /**
   * Returns {@code true} if an entry at {@code level} passes a filter set to this level.
   *
   * @param level the entry's level
   * @return whether the entry should be forwarded
   */
  public boolean admits(LogLevel level) {
    return level.ordinal() >= ordinal();
  }

  /**
   * Parses a level name. {@code "warning"} is accepted as {@link #WARN}; unknown or
   * null names resolve to {@link #INFO}.
   *
   * @param name level name, case-insensitive
   * @return the parsed level
   */
  public static LogLevel parse(String name) {
    if (name == null) {
      return INFO;
    }
    switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "debug":
        return DEBUG;
      case "warn":
      case "warning":
        return WARN;
      case "error":
        return ERROR;
      case "fatal":
        return FATAL;
      case "panic":
        return PANIC;
      default:
        return INFO;
    }
  }

  /**
   * Maps a {@code java.util.logging} level onto this scale.
   *
   * @param level the JUL level
   * @return SEVERE as error, WARNING as warn, INFO as info, anything finer as debug
   */
  public static LogLevel fromJul(Level level) {
    int value = level.intValue();
    if (value >= Level.SEVERE.intValue()) {
      return ERROR;
    }
    if (value >= Level.WARNING.intValue()) {
      return WARN;
    }
    if (value >= Level.INFO.intValue()) {
      return INFO;
    }
    return DEBUG;
  }

  /**
   * Maps this level onto {@code java.util.logging}, used when applying a configured
   * level to the host logger.
   */
  public Level toJul() {
    switch (this) {
      case DEBUG:
        return Level.FINE;
      case INFO:
        return Level.INFO;
      case WARN:
        return Level.WARNING;
      default:
        return Level.SEVERE;
    }
  }

  @Override
  public String toString() {
    return value;
  }
}
