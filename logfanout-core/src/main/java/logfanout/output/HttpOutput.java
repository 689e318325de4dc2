package logfanout.output;

import logfanout.LogEntry;
import logfanout.Output;
import logfanout.spi.MetricsExporter;
import logfanout.util.DaemonThreadFactory;
import logfanout.util.JsonCodec;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Buffers entries and POSTs them as JSON arrays to an HTTP collector.
 *
 * <p>A batch is sent when the buffer reaches {@code batchSize} entries, and a background
 * flusher sends whatever is buffered every {@code flushInterval}. Sends run on a single
 * sender thread, so {@link #write(LogEntry)} never waits for the network. Batches rejected
 * with a non-2xx status or lost to a transport error are dropped, logged and counted.
 */
public final class HttpOutput implements Output {
  private static final Logger logger = Logger.getLogger(HttpOutput.class.getName());

  static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

  private final URI url;
  private final String authToken;
  private final int batchSize;
  private final long drainTimeoutMs;
  private final MetricsExporter metrics;
  private final JsonCodec codec;
  private final HttpClient client;
  private final ScheduledExecutorService flusher;
  private final ExecutorService sender;
  private final Object bufferLock = new Object();
  // guarded by bufferLock for writes; read without it by probe
  private volatile boolean closed;
  private List<LogEntry> buffer;

  /**
   * Starts the periodic flusher.
   *
   * @param url            collector endpoint
   * @param authToken      bearer token, or empty for none
   * @param batchSize      entries per batch, must be positive
   * @param flushInterval  maximum time an entry waits in the buffer
   * @param drainTimeoutMs how long {@link #close()} waits for in-flight sends
   * @param metrics        batch outcome counters
   */
  public HttpOutput(URI url, String authToken, int batchSize, Duration flushInterval,
      long drainTimeoutMs, MetricsExporter metrics) {
    this.url = Objects.requireNonNull(url, "url");
    this.authToken = authToken == null ? "" : authToken;
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    Objects.requireNonNull(flushInterval, "flushInterval");
    if (flushInterval.isNegative() || flushInterval.isZero()) {
      throw new IllegalArgumentException("flushInterval must be positive");
    }
    this.batchSize = batchSize;
    this.drainTimeoutMs = drainTimeoutMs;
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    this.codec = JsonCodec.getDefault();
    this.client = HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .connectTimeout(REQUEST_TIMEOUT)
        .build();
    this.buffer = new ArrayList<>(batchSize);
    this.sender = Executors.newSingleThreadExecutor(new DaemonThreadFactory("logfanout-http-send-"));
    this.flusher = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("logfanout-http-flush-"));
    long intervalMs = flushInterval.toMillis();
    flusher.scheduleWithFixedDelay(this::flush, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  @Override
  public void write(LogEntry entry) throws IOException {
    synchronized (bufferLock) {
      if (closed) {
        throw new IOException("http output is closed");
      }
      buffer.add(entry);
      if (buffer.size() >= batchSize) {
        submit(swapBuffer());
      }
    }
  }

  /**
   * Posts a single-entry batch on the calling thread, bypassing the buffer.
   *
   * @throws IOException on a transport error or a non-2xx response
   */
  @Override
  public void probe(LogEntry entry) throws IOException {
    if (closed) {
      throw new IOException("http output is closed");
    }
    int status;
    try {
      status = client.send(request(List.of(entry)), HttpResponse.BodyHandlers.discarding())
          .statusCode();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("interrupted while sending to " + url, e);
    }
    if (status < 200 || status >= 300) {
      throw new IOException("HTTP endpoint returned status " + status);
    }
  }

  /**
   * Hands the buffered entries, if any, to the sender.
   */
  void flush() {
    synchronized (bufferLock) {
      if (!buffer.isEmpty()) {
        submit(swapBuffer());
      }
    }
  }

  private List<LogEntry> swapBuffer() {
    List<LogEntry> batch = buffer;
    buffer = new ArrayList<>(batchSize);
    return batch;
  }

  // Called under bufferLock so that close() cannot shut the sender down between a swap
  // and its submit.
  private void submit(List<LogEntry> batch) {
    try {
      sender.execute(() -> send(batch));
    } catch (RejectedExecutionException e) {
      metrics.incrementBatchFailed();
      logger.log(Level.WARNING, "Dropped batch of " + batch.size() + " entries for " + url
          + ": sender is shut down", e);
    }
  }

  private HttpRequest request(List<LogEntry> batch) {
    HttpRequest.Builder request = HttpRequest.newBuilder(url)
        .timeout(REQUEST_TIMEOUT)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(codec.toJsonArray(batch), StandardCharsets.UTF_8));
    if (!authToken.isEmpty()) {
      request.header("Authorization", "Bearer " + authToken);
    }
    return request.build();
  }

  private void send(List<LogEntry> batch) {
    try {
      HttpResponse<Void> response = client.send(request(batch),
          HttpResponse.BodyHandlers.discarding());
      int status = response.statusCode();
      if (status < 200 || status >= 300) {
        metrics.incrementBatchFailed();
        logger.log(Level.WARNING, "HTTP endpoint {0} returned status {1}, dropped {2} entries",
            new Object[] {url, status, batch.size()});
        return;
      }
      metrics.incrementBatchSent();
    } catch (IOException e) {
      metrics.incrementBatchFailed();
      logger.log(Level.WARNING, "Failed to send " + batch.size() + " entries to " + url, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      metrics.incrementBatchFailed();
      logger.log(Level.WARNING, "Interrupted while sending " + batch.size() + " entries to " + url, e);
    }
  }

  /**
   * Rejects further writes, sends what is buffered and waits up to the drain timeout for
   * in-flight batches. Every write that returned normally is part of a submitted batch.
   */
  @Override
  public void close() {
    synchronized (bufferLock) {
      if (closed) {
        return;
      }
      closed = true;
      flush();
    }
    flusher.shutdownNow();
    try {
      sender.shutdown();
      if (!sender.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "HTTP output {0} did not drain within {1} ms",
            new Object[] {url, drainTimeoutMs});
        sender.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      flusher.shutdownNow();
      sender.shutdownNow();
    }
  }

  @Override
  public String toString() {
    return "HttpOutput{" + url + ", batchSize=" + batchSize + '}';
  }
}
