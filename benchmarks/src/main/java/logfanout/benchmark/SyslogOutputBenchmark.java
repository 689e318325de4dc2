package logfanout.benchmark;

import logfanout.LogEntry;
import logfanout.LogLevel;
import logfanout.output.SyslogFormat;
import logfanout.output.SyslogOutput;
import logfanout.output.SyslogTransport;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Measures syslog frame rendering and the synchronized write path, with a transport that
 * hands each frame to a {@link Blackhole}.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar SyslogOutputBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class SyslogOutputBenchmark {

  @Param({"rfc3164", "rfc5424"})
  private String format;

  @Param({"0", "8"})
  private int fieldCount;

  private SyslogOutput output;
  private LogEntry entry;
  private volatile Blackhole sink;

  @Setup(Level.Trial)
  public void setup(Blackhole blackhole) throws Exception {
    sink = blackhole;
    output = new SyslogOutput(() -> new SyslogTransport() {
      @Override
      public void send(byte[] frame) {
        sink.consume(frame);
      }

      @Override
      public void close() {
      }
    }, "bench", SyslogFormat.fromValue(format));

    Map<String, Object> fields = new TreeMap<>();
    for (int i = 0; i < fieldCount; i++) {
      fields.put("key" + i, "value-" + i);
    }
    entry = LogEntry.of(LogLevel.INFO, "object stored", Map.copyOf(fields));
  }

  @TearDown(Level.Trial)
  public void tearDown() throws Exception {
    output.close();
  }

  @Benchmark
  public void write() throws Exception {
    output.write(entry);
  }
}
