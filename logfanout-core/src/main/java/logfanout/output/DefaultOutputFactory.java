package logfanout.output;

import logfanout.Output;
import logfanout.spi.MetricsExporter;
import logfanout.target.TargetConfig;
import logfanout.target.TargetType;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Optional;

/**
 * Opens {@link SyslogOutput}s and {@link HttpOutput}s according to the target type.
 */
public final class DefaultOutputFactory implements OutputFactory {
  private final MetricsExporter metrics;
  private final long drainTimeoutMs;

  public DefaultOutputFactory(MetricsExporter metrics, long drainTimeoutMs) {
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    this.drainTimeoutMs = drainTimeoutMs;
  }

  @Override
  public Output create(TargetConfig config) throws IOException {
    Optional<TargetType> type = TargetType.fromValue(config.type());
    if (type.isEmpty()) {
      throw new IllegalArgumentException("unsupported target type: " + config.type());
    }
    switch (type.get()) {
      case SYSLOG:
        return SyslogOutput.connect(config);
      case HTTP:
        return new HttpOutput(parseUrl(config.url()), config.authToken(),
            config.effectiveBatchSize(), Duration.ofSeconds(config.effectiveFlushIntervalSeconds()),
            drainTimeoutMs, metrics);
      default:
        throw new IllegalArgumentException("unsupported target type: " + config.type());
    }
  }

  private static URI parseUrl(String url) throws IOException {
    try {
      URI uri = new URI(url);
      String scheme = uri.getScheme();
      if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
        throw new IOException("invalid HTTP target url: " + url);
      }
      return uri;
    } catch (URISyntaxException e) {
      throw new IOException("invalid HTTP target url: " + url, e);
    }
  }
}
