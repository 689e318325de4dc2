package logfanout.spi;

/**
 * Observability hook for exporting dispatch counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implementations are called
 * from the logging hot path and must not block or log.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of entries accepted into an output's queue.
   */
  void incrementEnqueued();

  /**
   * Increments the count of entries dropped because an output's queue was full or closed.
   */
  void incrementDropped();

  /**
   * Increments the count of failed output writes.
   */
  void incrementWriteFailure();

  /**
   * Increments the count of outputs that could not be created during reconciliation.
   */
  void incrementOutputCreateFailure();

  /**
   * Increments the count of HTTP batches delivered with a 2xx response.
   */
  default void incrementBatchSent() {
  }

  /**
   * Increments the count of HTTP batches dropped after a failed delivery.
   */
  default void incrementBatchFailed() {
  }

  /**
   * Records the number of outputs active after a reconciliation.
   *
   * @param activeTargets number of live outputs
   */
  void recordActiveTargets(int activeTargets);

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementEnqueued() {
    }

    @Override
    public void incrementDropped() {
    }

    @Override
    public void incrementWriteFailure() {
    }

    @Override
    public void incrementOutputCreateFailure() {
    }

    @Override
    public void recordActiveTargets(int activeTargets) {
    }
  }
}
