/**
 * Spring Boot auto-configuration for logfanout.
 *
 * <p>{@link logfanout.spring.boot.LogFanoutAutoConfiguration} wires a
 * {@link logfanout.TargetManager} from a {@code DataSource} and {@code logfanout.*}
 * application properties.
 *
 * @see logfanout.spring.boot.LogFanoutProperties
 * @see logfanout.spring.boot.EnvironmentSettingsReader
 */
package logfanout.spring.boot;
