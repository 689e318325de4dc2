package logfanout.spring.boot;

import logfanout.LogEntry;
import logfanout.Output;
import logfanout.TargetManager;
import logfanout.dispatch.DispatchHook;
import logfanout.jdbc.DataSourceConnectionProvider;
import logfanout.jdbc.store.AbstractJdbcTargetStore;
import logfanout.jdbc.store.H2TargetStore;
import logfanout.output.OutputFactory;
import logfanout.spi.SettingsReader;
import logfanout.spi.TargetStore;
import logfanout.target.LegacySettings;
import logfanout.target.TargetConfig;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class LogFanoutAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          LogFanoutAutoConfiguration.class))
      .withUserConfiguration(StubOutputConfig.class)
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.schema-locations=classpath:schema/h2.sql",
          "logfanout.logger-name=logfanout.starter.test");

  @Test
  void createsDefaultBeans() {
    runner.run(ctx -> {
      assertInstanceOf(H2TargetStore.class, ctx.getBean(TargetStore.class));
      assertInstanceOf(EnvironmentSettingsReader.class, ctx.getBean(SettingsReader.class));
      TargetManager manager = ctx.getBean(TargetManager.class);
      assertSame(ctx.getBean(TargetStore.class), manager.getTargetStore());
      assertEquals(0, manager.getActiveOutputs());
    });
  }

  @Test
  void reconfigurePicksUpStoredTargets() {
    runner.run(ctx -> {
      TargetStore store = ctx.getBean(TargetStore.class);
      TargetManager manager = ctx.getBean(TargetManager.class);

      store.create(TargetConfig.builder()
          .name("collector")
          .type("http")
          .enabled(true)
          .url("http://127.0.0.1:9/ingest")
          .filterLevel("info")
          .build());
      manager.reconfigure();

      assertEquals(1, manager.getActiveOutputs());
    });
  }

  @Test
  void migratesLegacySettingsFromEnvironment() {
    runner.withPropertyValues(
            "logfanout.settings.logging.syslog_enabled=true",
            "logfanout.settings.logging.syslog_host=syslog.example.com",
            "logfanout.settings.logging.syslog_port=1514")
        .run(ctx -> {
          List<TargetConfig> targets = ctx.getBean(TargetStore.class).list();
          assertEquals(1, targets.size());
          assertEquals(LegacySettings.SYSLOG_TARGET_NAME, targets.get(0).name());
          assertEquals(1514, targets.get(0).port());
          assertEquals(1, ctx.getBean(TargetManager.class).getActiveOutputs());
        });
  }

  @Test
  void migrationCanBeDisabled() {
    runner.withPropertyValues(
            "logfanout.migrate-legacy-settings=false",
            "logfanout.settings.logging.syslog_enabled=true",
            "logfanout.settings.logging.syslog_host=syslog.example.com")
        .run(ctx -> {
          assertTrue(ctx.getBean(TargetStore.class).list().isEmpty());
          assertEquals(0, ctx.getBean(TargetManager.class).getActiveOutputs());
        });
  }

  @Test
  void customTableName() {
    runner.withPropertyValues(
            "logfanout.table-name=app_log_targets",
            "spring.sql.init.schema-locations=classpath:schema-custom.sql")
        .run(ctx -> {
          AbstractJdbcTargetStore store = ctx.getBean(AbstractJdbcTargetStore.class);
          assertInstanceOf(H2TargetStore.class, store);
          assertEquals("app_log_targets", store.tableName());
          assertTrue(store.list().isEmpty());
        });
  }

  @Test
  void disabledByProperty() {
    runner.withPropertyValues("logfanout.enabled=false").run(ctx -> {
      assertFalse(ctx.containsBean("targetManager"));
      assertTrue(ctx.getBeansOfType(TargetStore.class).isEmpty());
    });
  }

  @Test
  void backsOffWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(LogFanoutAutoConfiguration.class))
        .run(ctx -> assertTrue(ctx.getBeansOfType(TargetManager.class).isEmpty()));
  }

  @Test
  void customTargetStoreWins() {
    runner.withUserConfiguration(CustomStoreConfig.class).run(ctx -> {
      TargetStore store = ctx.getBean(TargetStore.class);
      assertEquals("custom_targets", ((AbstractJdbcTargetStore) store).tableName());
      assertSame(store, ctx.getBean(TargetManager.class).getTargetStore());
    });
  }

  @Test
  void managerIsClosedWithContext() {
    Logger hostLogger = Logger.getLogger("logfanout.starter.test");
    runner.run(ctx -> assertEquals(1, countHooks(hostLogger)));
    assertEquals(0, countHooks(hostLogger));
  }

  private static long countHooks(Logger logger) {
    return Arrays.stream(logger.getHandlers())
        .filter(h -> h instanceof DispatchHook)
        .count();
  }

  @Configuration
  static class StubOutputConfig {
    @Bean
    OutputFactory stubOutputFactory() {
      return cfg -> new Output() {
        @Override
        public void write(LogEntry entry) {
        }

        @Override
        public void close() {
        }
      };
    }
  }

  @Configuration
  static class CustomStoreConfig {
    @Bean
    TargetStore customTargetStore(DataSource dataSource) {
      return new H2TargetStore("custom_targets",
          new DataSourceConnectionProvider(dataSource));
    }
  }
}
