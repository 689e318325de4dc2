package logfanout.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import logfanout.micrometer.MicrometerMetricsExporter;
import logfanout.spi.MetricsExporter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogFanoutMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(LogFanoutMicrometerAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerExporterByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
            MeterRegistry registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("logfanout.dispatch.enqueued").counter());
            assertNotNull(registry.find("logfanout.targets.active").gauge());
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("logfanout.metrics.name-prefix=audit.logs").run(ctx -> {
            MeterRegistry registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("audit.logs.dispatch.dropped").counter());
            assertNull(registry.find("logfanout.dispatch.dropped").counter());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("logfanout.metrics.enabled=false").run(ctx ->
                assertFalse(ctx.containsBean("micrometerMetricsExporter")));
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
            MetricsExporter exporter = ctx.getBean(MetricsExporter.class);
            assertFalse(exporter instanceof MicrometerMetricsExporter);
        });
    }

    @Test
    void metersRemovedWhenContextCloses() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(LogFanoutMicrometerAutoConfiguration.class))
                .withBean(MeterRegistry.class, () -> registry)
                .run(ctx -> assertNotNull(registry.find("logfanout.write.failure").counter()));

        assertTrue(registry.getMeters().isEmpty());
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomExporterConfig {
        @Bean
        MetricsExporter customMetricsExporter() {
            return MetricsExporter.NOOP;
        }
    }
}
