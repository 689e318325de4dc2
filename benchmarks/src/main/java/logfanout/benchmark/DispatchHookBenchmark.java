package logfanout.benchmark;

import logfanout.LogEntry;
import logfanout.LogLevel;
import logfanout.Output;
import logfanout.dispatch.DispatchHook;
import logfanout.dispatch.DispatchSnapshot;
import logfanout.dispatch.OutputRoute;
import logfanout.dispatch.QueuedOutput;
import logfanout.spi.MetricsExporter;
import org.openjdk.jmh.annotations.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.logging.LogRecord;

/**
 * Measures the logging hot path: snapshot load, level filter and queue offer per target.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar DispatchHookBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class DispatchHookBenchmark {

  @Param({"1", "4", "16"})
  private int targets;

  @Param({"info", "error"})
  private String filterLevel;

  private DispatchHook hook;
  private List<QueuedOutput> outputs;
  private LogEntry entry;
  private LogRecord record;

  @Setup(Level.Trial)
  public void setup() {
    hook = new DispatchHook(MetricsExporter.NOOP);
    outputs = new ArrayList<>(targets);
    List<OutputRoute> routes = new ArrayList<>(targets);
    for (int i = 0; i < targets; i++) {
      QueuedOutput queued = new QueuedOutput("bench-" + i, new DiscardingOutput(), 10_000, 1000,
          MetricsExporter.NOOP, hook);
      outputs.add(queued);
      routes.add(new OutputRoute("bench-" + i, "bench-" + i, queued, LogLevel.parse(filterLevel)));
    }
    hook.updateSnapshot(DispatchSnapshot.of(routes));

    entry = LogEntry.of(LogLevel.WARN, "request completed",
        Map.of("status", 200, "path", "/api/v1/objects", "duration_ms", 12));
    record = new LogRecord(java.util.logging.Level.WARNING, "request completed");
    record.setLoggerName("app.http");
    record.setParameters(new Object[] {Map.of("status", 200, "path", "/api/v1/objects")});
  }

  @TearDown(Level.Trial)
  public void tearDown() throws Exception {
    hook.close();
    for (QueuedOutput output : outputs) {
      output.close();
    }
  }

  @Benchmark
  public void fire() {
    hook.fire(entry);
  }

  @Benchmark
  public void publishJulRecord() {
    hook.publish(record);
  }

  static final class DiscardingOutput implements Output {
    @Override
    public void write(LogEntry entry) {
    }

    @Override
    public void close() {
    }
  }
}
