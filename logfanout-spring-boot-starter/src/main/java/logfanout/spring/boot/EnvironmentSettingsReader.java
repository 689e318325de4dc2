package logfanout.spring.boot;

import logfanout.spi.SettingsReader;
import org.springframework.core.env.Environment;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link SettingsReader} backed by the Spring {@link Environment}. A key such as
 * {@code logging.level} is read from {@code <prefix>logging.level}, so the host's
 * settings do not collide with Spring Boot's own {@code logging.*} properties.
 */
public final class EnvironmentSettingsReader implements SettingsReader {
  private final Environment environment;
  private final String prefix;

  public EnvironmentSettingsReader(Environment environment, String prefix) {
    this.environment = Objects.requireNonNull(environment, "environment");
    this.prefix = prefix == null ? "" : prefix;
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(environment.getProperty(prefix + key));
  }
}
