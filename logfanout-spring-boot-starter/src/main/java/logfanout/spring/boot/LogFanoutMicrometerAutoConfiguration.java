package logfanout.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import logfanout.micrometer.MicrometerMetricsExporter;
import logfanout.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath and
 * {@code logfanout.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link LogFanoutAutoConfiguration} so the exporter is injected into the
 * target manager.
 */
@AutoConfiguration(before = LogFanoutAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "logfanout.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(LogFanoutProperties.class)
public class LogFanoutMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, LogFanoutProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
