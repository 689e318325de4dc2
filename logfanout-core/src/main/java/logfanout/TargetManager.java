package logfanout;

import logfanout.dispatch.DispatchHook;
import logfanout.dispatch.DispatchSnapshot;
import logfanout.dispatch.OutputRoute;
import logfanout.dispatch.QueuedOutput;
import logfanout.output.DefaultOutputFactory;
import logfanout.output.OutputFactory;
import logfanout.spi.MetricsExporter;
import logfanout.spi.SettingsReader;
import logfanout.spi.TargetStore;
import logfanout.target.LegacySettings;
import logfanout.target.TargetConfig;
import logfanout.target.TargetNotFoundException;
import logfanout.target.TargetValidationException;
import logfanout.target.TargetValidator;
import logfanout.util.JsonLogFormatter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Owns the live outputs and keeps them converged with the configured logging targets.
 *
 * <p>{@link #reconfigure()} reads the enabled targets (from the attached {@link TargetStore},
 * or from legacy settings when no store is attached), closes outputs whose target went
 * away, recreates outputs whose connection settings changed, opens outputs for new targets
 * and publishes a fresh {@link DispatchSnapshot} to the {@link DispatchHook}. A target whose
 * output cannot be opened is skipped for that pass and retried on the next one.
 *
 * <p>The hook is attached to the host logger, and the manager logs through the same logging
 * framework. To keep the two from deadlocking, the hook never takes the manager's lock and
 * every log record the manager produces while holding the lock is emitted only after the
 * lock has been released.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * TargetManager manager = TargetManager.builder()
 *     .metrics(metrics)
 *     .build();
 * manager.setSettingsReader(settings);
 * manager.initTargetStore(store);
 * ...
 * manager.close();
 * }</pre>
 *
 * @see DispatchHook
 * @see TargetStore
 */
public final class TargetManager implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(TargetManager.class.getName());

  static final String SETTING_LEVEL = "logging.level";
  static final String SETTING_FORMAT = "logging.format";
  static final String SETTING_INCLUDE_CALLER = "logging.include_caller";

  private final OutputFactory outputFactory;
  private final MetricsExporter metrics;
  private final int queueCapacity;
  private final long drainTimeoutMs;
  private final Logger hostLogger;
  private final DispatchHook dispatchHook;

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, QueuedOutput> outputs = new HashMap<>();
  private final Map<String, TargetConfig> targetConfigs = new HashMap<>();
  private final AtomicBoolean closed = new AtomicBoolean();
  private SettingsReader settingsReader;
  private TargetStore targetStore;

  private TargetManager(Builder builder) {
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.queueCapacity = builder.queueCapacity;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.outputFactory = builder.outputFactory != null
        ? builder.outputFactory : new DefaultOutputFactory(metrics, drainTimeoutMs);
    this.hostLogger = builder.hostLogger != null ? builder.hostLogger : Logger.getLogger("");
    this.dispatchHook = new DispatchHook(metrics);
    hostLogger.addHandler(dispatchHook);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Attaches the host settings source and reconfigures.
   *
   * @param settings the settings source
   */
  public void setSettingsReader(SettingsReader settings) {
    lock.writeLock().lock();
    try {
      this.settingsReader = settings;
    } finally {
      lock.writeLock().unlock();
    }
    reconfigure();
  }

  /**
   * Attaches a target store and reconfigures from it.
   *
   * @param store the target store
   */
  public void setTargetStore(TargetStore store) {
    lock.writeLock().lock();
    try {
      this.targetStore = store;
    } finally {
      lock.writeLock().unlock();
    }
    reconfigure();
  }

  /**
   * Migrates legacy settings into an empty store, then attaches it.
   *
   * <p>Migration only runs when a settings reader is attached and the store holds no
   * targets. A failed migration is logged and the store is attached anyway.
   *
   * @param store the target store
   */
  public void initTargetStore(TargetStore store) {
    Objects.requireNonNull(store, "store");
    SettingsReader settings;
    lock.readLock().lock();
    try {
      settings = settingsReader;
    } finally {
      lock.readLock().unlock();
    }

    if (settings != null) {
      try {
        if (store.list().isEmpty()) {
          List<TargetConfig> migrated = store.migrateFromLegacySettings(settings);
          if (!migrated.isEmpty()) {
            logger.info("Migrated " + migrated.size() + " legacy logging target(s)");
          }
        }
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to migrate legacy logging settings", e);
      }
    }
    setTargetStore(store);
  }

  /**
   * Returns the attached store, for callers that manage targets.
   *
   * @return the store, or null if none is attached
   */
  public TargetStore getTargetStore() {
    lock.readLock().lock();
    try {
      return targetStore;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Converges the live outputs with the enabled targets and publishes a new snapshot.
   */
  public void reconfigure() {
    List<LogRecord> deferred = new ArrayList<>();
    lock.writeLock().lock();
    try {
      if (closed.get()) {
        return;
      }
      Map<String, Object> hostSettings = applyHostSettings();

      List<TargetConfig> desired = loadDesiredTargets(deferred);
      if (desired != null) {
        reconcile(desired, deferred);
      }
      publishSnapshot();

      Map<String, Object> summary = new LinkedHashMap<>(hostSettings);
      summary.put("active_targets", outputs.size());
      deferred.add(record(Level.INFO, "Logging configuration updated", summary, null));
    } finally {
      lock.writeLock().unlock();
    }
    emit(deferred);
  }

  /**
   * Returns null when the current outputs should be kept untouched.
   */
  private List<TargetConfig> loadDesiredTargets(List<LogRecord> deferred) {
    if (targetStore != null) {
      try {
        return targetStore.listEnabled();
      } catch (RuntimeException e) {
        deferred.add(record(Level.SEVERE, "Failed to list enabled logging targets", Map.of(), e));
        return null;
      }
    }
    if (settingsReader == null) {
      return List.of();
    }
    List<TargetConfig> legacy = new ArrayList<>(2);
    for (TargetConfig cfg : LegacySettings.readRunnableTargets(settingsReader)) {
      try {
        TargetValidator.validate(cfg);
        legacy.add(cfg);
      } catch (TargetValidationException e) {
        deferred.add(record(Level.WARNING, "Ignoring invalid legacy logging settings",
            Map.of("target_name", cfg.name()), e));
      }
    }
    return legacy;
  }

  private void reconcile(List<TargetConfig> desired, List<LogRecord> deferred) {
    Map<String, TargetConfig> desiredById = new LinkedHashMap<>();
    for (TargetConfig cfg : desired) {
      desiredById.put(cfg.id(), cfg);
    }

    for (String id : new ArrayList<>(outputs.keySet())) {
      if (!desiredById.containsKey(id)) {
        closeQuietly(outputs.remove(id), id, deferred);
        targetConfigs.remove(id);
        deferred.add(record(Level.INFO, "Logging target removed", Map.of("target_id", id), null));
      }
    }

    for (TargetConfig cfg : desiredById.values()) {
      String id = cfg.id();
      TargetConfig existing = targetConfigs.get(id);
      if (existing != null && outputs.containsKey(id) && !existing.connectionSettingsDiffer(cfg)) {
        // same connection; refresh so a new filter level or name is picked up
        targetConfigs.put(id, cfg);
        continue;
      }

      QueuedOutput previous = outputs.remove(id);
      targetConfigs.remove(id);
      if (previous != null) {
        closeQuietly(previous, id, deferred);
      }

      Output output;
      try {
        output = outputFactory.create(cfg);
      } catch (IOException | RuntimeException e) {
        metrics.incrementOutputCreateFailure();
        deferred.add(record(Level.SEVERE, "Failed to create logging output", targetFields(cfg), e));
        continue;
      }

      outputs.put(id, new QueuedOutput(id, output, queueCapacity, drainTimeoutMs, metrics,
          dispatchHook));
      targetConfigs.put(id, cfg);

      Map<String, Object> fields = targetFields(cfg);
      fields.put("host", cfg.host());
      fields.put("port", cfg.port());
      deferred.add(record(Level.INFO, "Logging target configured", fields, null));
    }
  }

  private Map<String, Object> applyHostSettings() {
    Map<String, Object> applied = new LinkedHashMap<>();
    if (settingsReader == null) {
      return applied;
    }
    String format = settingsReader.get(SETTING_FORMAT).orElse("json");
    LogLevel level = LogLevel.parse(settingsReader.get(SETTING_LEVEL).orElse("info"));
    boolean includeCaller = settingsReader.getBool(SETTING_INCLUDE_CALLER).orElse(false);

    hostLogger.setLevel(level.toJul());
    for (Handler handler : hostLogger.getHandlers()) {
      if (handler == dispatchHook) {
        continue;
      }
      handler.setFormatter("json".equals(format)
          ? new JsonLogFormatter(includeCaller) : new SimpleFormatter());
    }

    applied.put("format", format);
    applied.put("level", level.value());
    applied.put("include_caller", includeCaller);
    return applied;
  }

  /**
   * Loads a stored target and tests it with {@link #testTargetConfig(TargetConfig)}.
   *
   * @param id target id
   * @throws IllegalStateException if no store is attached
   * @throws TargetNotFoundException if the target does not exist
   * @throws IOException if the target cannot be reached
   */
  public void testTarget(String id) throws IOException {
    TargetStore store = getTargetStore();
    if (store == null) {
      throw new IllegalStateException("target store is not attached");
    }
    testTargetConfig(store.get(id));
  }

  /**
   * Opens a temporary output for an unsaved target, delivers one test entry and closes it.
   *
   * @param cfg the target to test
   * @throws TargetValidationException if the config is invalid
   * @throws IOException if the output cannot be opened or the entry cannot be delivered
   */
  public void testTargetConfig(TargetConfig cfg) throws IOException {
    TargetValidator.validate(cfg);
    Output output;
    try {
      output = outputFactory.create(cfg);
    } catch (IOException e) {
      throw new IOException("failed to create test output: " + e.getMessage(), e);
    }
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("test", true);
    fields.put("target_name", cfg.name());
    fields.put("target_type", cfg.type());
    try (Output closing = output) {
      closing.probe(LogEntry.of(LogLevel.INFO, "logfanout target connectivity test", fields));
    }
  }

  /**
   * Closes and forgets one live output, then republishes the snapshot. Does nothing if the
   * target has no live output.
   *
   * @param id target id
   */
  public void closeOutput(String id) {
    List<LogRecord> deferred = new ArrayList<>();
    lock.writeLock().lock();
    try {
      QueuedOutput output = outputs.remove(id);
      targetConfigs.remove(id);
      if (output == null) {
        return;
      }
      closeQuietly(output, id, deferred);
      publishSnapshot();
      deferred.add(record(Level.INFO, "Output closed", Map.of("target_id", id), null));
    } finally {
      lock.writeLock().unlock();
    }
    emit(deferred);
  }

  /**
   * Returns the number of live outputs.
   *
   * @return live output count
   */
  public int getActiveOutputs() {
    lock.readLock().lock();
    try {
      return outputs.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Returns the handler attached to the host logger. Entries can also be fed to it
   * directly through {@link DispatchHook#fire(LogEntry)}.
   *
   * @return the dispatch hook
   */
  public DispatchHook dispatchHook() {
    return dispatchHook;
  }

  /**
   * Closes every output, publishes an empty snapshot and detaches the hook from the host
   * logger. Later calls to {@link #reconfigure()} do nothing.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    List<LogRecord> deferred = new ArrayList<>();
    lock.writeLock().lock();
    try {
      for (Map.Entry<String, QueuedOutput> entry : outputs.entrySet()) {
        closeQuietly(entry.getValue(), entry.getKey(), deferred);
        deferred.add(record(Level.INFO, "Output closed on shutdown",
            Map.of("target_id", entry.getKey()), null));
      }
      outputs.clear();
      targetConfigs.clear();
      publishSnapshot();
    } finally {
      lock.writeLock().unlock();
    }
    hostLogger.removeHandler(dispatchHook);
    dispatchHook.close();
    emit(deferred);
  }

  /** Must be called under the write lock. */
  private void publishSnapshot() {
    List<OutputRoute> routes = new ArrayList<>(outputs.size());
    for (Map.Entry<String, QueuedOutput> entry : outputs.entrySet()) {
      TargetConfig cfg = targetConfigs.get(entry.getKey());
      LogLevel filter = cfg != null ? LogLevel.parse(cfg.filterLevel()) : LogLevel.DEBUG;
      String name = cfg != null ? cfg.name() : "";
      routes.add(new OutputRoute(entry.getKey(), name, entry.getValue(), filter));
    }
    dispatchHook.updateSnapshot(DispatchSnapshot.of(routes));
    metrics.recordActiveTargets(routes.size());
  }

  private static void closeQuietly(QueuedOutput output, String id, List<LogRecord> deferred) {
    try {
      output.close();
    } catch (IOException e) {
      deferred.add(record(Level.WARNING, "Failed to close logging output",
          Map.of("target_id", id), e));
    }
  }

  private static Map<String, Object> targetFields(TargetConfig cfg) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("target_id", cfg.id());
    fields.put("target_name", cfg.name());
    fields.put("target_type", cfg.type());
    return fields;
  }

  /**
   * Builds a record carrying structured fields as its single parameter, which the
   * dispatch hook turns into entry fields.
   */
  private static LogRecord record(Level level, String message, Map<String, Object> fields,
      Throwable thrown) {
    LogRecord record = new LogRecord(level, message);
    record.setLoggerName(logger.getName());
    record.setParameters(new Object[] {fields});
    record.setThrown(thrown);
    return record;
  }

  /** Must be called without holding the lock. */
  private static void emit(List<LogRecord> deferred) {
    for (LogRecord record : deferred) {
      logger.log(record);
    }
  }

  /** Builder for {@link TargetManager}. */
  public static final class Builder {
    private OutputFactory outputFactory;
    private MetricsExporter metrics;
    private int queueCapacity = 1000;
    private long drainTimeoutMs = 5000;
    private Logger hostLogger;

    private Builder() {}

    /**
     * Sets the factory that opens outputs for targets.
     *
     * <p>Optional. Defaults to {@link DefaultOutputFactory}.
     *
     * @param outputFactory the output factory
     * @return this builder
     */
    public Builder outputFactory(OutputFactory outputFactory) {
      this.outputFactory = outputFactory;
      return this;
    }

    /**
     * Sets the metrics exporter for dispatch and output counters.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the per-target queue capacity. Entries offered to a full queue are dropped.
     *
     * <p>Optional. Defaults to {@code 1000}.
     *
     * @param queueCapacity entries per target queue
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Sets how long closing an output waits for queued entries and in-flight batches.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets the logger the dispatch hook is attached to and to which {@code logging.level}
     * and {@code logging.format} are applied.
     *
     * <p>Optional. Defaults to the root logger.
     *
     * @param hostLogger the host logger
     * @return this builder
     */
    public Builder hostLogger(Logger hostLogger) {
      this.hostLogger = hostLogger;
      return this;
    }

    public TargetManager build() {
      return new TargetManager(this);
    }
  }
}
