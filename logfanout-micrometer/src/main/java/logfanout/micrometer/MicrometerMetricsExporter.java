package logfanout.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import logfanout.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code logfanout.dispatch.enqueued}: entries accepted into an output queue</li>
 *   <li>{@code logfanout.dispatch.dropped}: entries dropped (queue full or closed)</li>
 *   <li>{@code logfanout.write.failure}: failed output writes</li>
 *   <li>{@code logfanout.output.create.failure}: outputs that could not be opened</li>
 *   <li>{@code logfanout.http.batch.sent}: HTTP batches delivered</li>
 *   <li>{@code logfanout.http.batch.failed}: HTTP batches dropped after a failed send</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code logfanout.targets.active}: live outputs after the last reconciliation</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter enqueued;
    private final Counter dropped;
    private final Counter writeFailure;
    private final Counter createFailure;
    private final Counter batchSent;
    private final Counter batchFailed;
    private final Gauge activeTargetsGauge;

    private final AtomicInteger activeTargets = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "logfanout"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "logfanout");
    }

    /**
     * Creates an exporter with a custom metric name prefix, for hosts running more than
     * one target manager.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "audit.logfanout"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.enqueued = Counter.builder(namePrefix + ".dispatch.enqueued")
                .description("Log entries accepted into an output queue")
                .register(registry);
        this.dropped = Counter.builder(namePrefix + ".dispatch.dropped")
                .description("Log entries dropped because an output queue was full or closed")
                .register(registry);
        this.writeFailure = Counter.builder(namePrefix + ".write.failure")
                .description("Failed output writes")
                .register(registry);
        this.createFailure = Counter.builder(namePrefix + ".output.create.failure")
                .description("Outputs that could not be created during reconciliation")
                .register(registry);
        this.batchSent = Counter.builder(namePrefix + ".http.batch.sent")
                .description("HTTP batches delivered with a 2xx response")
                .register(registry);
        this.batchFailed = Counter.builder(namePrefix + ".http.batch.failed")
                .description("HTTP batches dropped after a failed delivery")
                .register(registry);

        this.activeTargetsGauge = Gauge.builder(namePrefix + ".targets.active", activeTargets, AtomicInteger::get)
                .description("Live outputs after the last reconciliation")
                .register(registry);
    }

    @Override
    public void incrementEnqueued() {
        if (closed) return;
        enqueued.increment();
    }

    @Override
    public void incrementDropped() {
        if (closed) return;
        dropped.increment();
    }

    @Override
    public void incrementWriteFailure() {
        if (closed) return;
        writeFailure.increment();
    }

    @Override
    public void incrementOutputCreateFailure() {
        if (closed) return;
        createFailure.increment();
    }

    @Override
    public void incrementBatchSent() {
        if (closed) return;
        batchSent.increment();
    }

    @Override
    public void incrementBatchFailed() {
        if (closed) return;
        batchFailed.increment();
    }

    @Override
    public void recordActiveTargets(int activeTargets) {
        if (closed) return;
        this.activeTargets.set(activeTargets);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this after the {@link logfanout.TargetManager} using it is closed, so no
     * stale gauge stays registered.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(enqueued, dropped, writeFailure, createFailure,
                batchSent, batchFailed, activeTargetsGauge)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
