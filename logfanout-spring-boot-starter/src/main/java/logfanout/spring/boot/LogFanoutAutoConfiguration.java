package logfanout.spring.boot;

import logfanout.TargetManager;
import logfanout.jdbc.store.AbstractJdbcTargetStore;
import logfanout.jdbc.store.JdbcTargetStores;
import logfanout.output.OutputFactory;
import logfanout.spi.MetricsExporter;
import logfanout.spi.SettingsReader;
import logfanout.spi.TargetStore;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.sql.init.dependency.DependsOnDatabaseInitialization;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

import javax.sql.DataSource;
import java.util.logging.Logger;

/**
 * Auto-configuration for logfanout.
 *
 * <p>Detects the target store dialect from the {@link DataSource}, reads host settings
 * from the Spring {@link Environment} and starts a {@link TargetManager} attached to the
 * configured JUL logger. After targets are changed through the {@link TargetStore} bean,
 * call {@link TargetManager#reconfigure()} to apply them.
 *
 * @see LogFanoutProperties
 * @see LogFanoutMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(TargetManager.class)
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "logfanout", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(LogFanoutProperties.class)
public class LogFanoutAutoConfiguration {

  @Bean
  @DependsOnDatabaseInitialization
  @ConditionalOnMissingBean(TargetStore.class)
  public AbstractJdbcTargetStore targetStore(DataSource dataSource, LogFanoutProperties props) {
    return JdbcTargetStores.forDataSource(dataSource, props.getTableName());
  }

  @Bean
  @ConditionalOnMissingBean(SettingsReader.class)
  public EnvironmentSettingsReader settingsReader(Environment environment, LogFanoutProperties props) {
    return new EnvironmentSettingsReader(environment, props.getSettingsPrefix());
  }

  @Bean(destroyMethod = "close")
  @DependsOnDatabaseInitialization
  @ConditionalOnMissingBean
  public TargetManager targetManager(LogFanoutProperties props,
      TargetStore targetStore,
      SettingsReader settingsReader,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<OutputFactory> outputFactoryProvider) {

    TargetManager manager = TargetManager.builder()
        .hostLogger(Logger.getLogger(props.getLoggerName()))
        .queueCapacity(props.getDispatch().getQueueCapacity())
        .drainTimeoutMs(props.getDispatch().getDrainTimeoutMs())
        .metrics(metricsProvider.getIfAvailable())
        .outputFactory(outputFactoryProvider.getIfAvailable())
        .build();

    manager.setSettingsReader(settingsReader);
    if (props.isMigrateLegacySettings()) {
      manager.initTargetStore(targetStore);
    } else {
      manager.setTargetStore(targetStore);
    }
    return manager;
  }
}
