package logfanout.dispatch;

import logfanout.LogEntry;
import logfanout.Output;
import logfanout.spi.MetricsExporter;
import logfanout.util.DaemonThreadFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Gives one {@link Output} its own bounded FIFO queue and worker thread.
 *
 * <p>{@link #offer(LogEntry)} never blocks: when the queue is full or the output is closing
 * the entry is refused. Entries for one target are written in the order they were accepted.
 * {@link #close()} stops accepting, drains what is queued within the drain timeout and then
 * closes the wrapped output.
 */
public final class QueuedOutput implements Closeable {
  private static final Logger logger = Logger.getLogger(QueuedOutput.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final String targetId;
  private final Output delegate;
  private final BlockingQueue<LogEntry> queue;
  private final ExecutorService worker;
  private final long drainTimeoutMs;
  private final MetricsExporter metrics;
  private final WriteFailureListener failureListener;
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final AtomicBoolean running = new AtomicBoolean(true);

  /**
   * Starts the worker.
   *
   * @param targetId        owning target, used in thread names and failure reports
   * @param delegate        the output to write to; closed by {@link #close()}
   * @param capacity        queue capacity, must be positive
   * @param drainTimeoutMs  how long {@link #close()} waits for queued entries
   * @param metrics         write failure counter
   * @param failureListener receives write errors, may be null
   */
  public QueuedOutput(String targetId, Output delegate, int capacity, long drainTimeoutMs,
      MetricsExporter metrics, WriteFailureListener failureListener) {
    this.targetId = Objects.requireNonNull(targetId, "targetId");
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    if (drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.drainTimeoutMs = drainTimeoutMs;
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    this.failureListener = failureListener;
    this.worker = Executors.newSingleThreadExecutor(
        new DaemonThreadFactory("logfanout-output-" + targetId + "-"));
    worker.execute(this::workerLoop);
  }

  /**
   * Queues an entry without blocking.
   *
   * @param entry the entry
   * @return {@code false} if the queue is full or the output is closed
   */
  public boolean offer(LogEntry entry) {
    if (!accepting.get()) {
      return false;
    }
    return queue.offer(entry);
  }

  public String targetId() {
    return targetId;
  }

  /** The wrapped output. */
  public Output delegate() {
    return delegate;
  }

  /** Number of entries waiting to be written. */
  public int pending() {
    return queue.size();
  }

  private void workerLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        if (!running.get() && queue.isEmpty()) {
          break;
        }
        LogEntry entry = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (entry != null) {
          writeOne(entry);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private void writeOne(LogEntry entry) {
    try {
      delegate.write(entry);
    } catch (Exception e) {
      metrics.incrementWriteFailure();
      if (failureListener != null) {
        failureListener.onWriteFailure(targetId, e);
      }
    }
  }

  /**
   * Stops accepting entries, writes what is queued within the drain timeout, then closes
   * the wrapped output. Entries still queued after the timeout are discarded.
   *
   * @throws IOException if the wrapped output fails to close
   */
  @Override
  public void close() throws IOException {
    if (!accepting.compareAndSet(true, false)) {
      return;
    }
    running.set(false);
    worker.shutdown();
    try {
      if (!worker.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        int remaining = queue.size();
        worker.shutdownNow();
        queue.clear();
        logger.log(Level.WARNING, "Drain timeout exceeded for target " + targetId
            + "; discarded " + remaining + " queued entries");
      }
    } catch (InterruptedException e) {
      worker.shutdownNow();
      Thread.currentThread().interrupt();
    }
    delegate.close();
  }

  @Override
  public String toString() {
    return "QueuedOutput{" + targetId + " -> " + delegate + '}';
  }
}
