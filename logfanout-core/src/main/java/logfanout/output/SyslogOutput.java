package logfanout.output;

import logfanout.LogEntry;
import logfanout.Output;
import logfanout.target.TargetConfig;
import logfanout.util.JsonCodec;

import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends entries to a syslog collector over TCP, UDP or TLS.
 *
 * <p>Writes are serialized on the output. A failed write closes the connection, redials
 * once and retries once; if either step fails the connection is dropped and every later
 * write fails until the output is replaced. Facility is always {@code daemon}.
 *
 * <p>{@link #close()} does not wait for an in-flight write: it closes the connection
 * under the writer, which then fails with "syslog connection is closed".
 */
public final class SyslogOutput implements Output {
  private static final Logger logger = Logger.getLogger(SyslogOutput.class.getName());

  static final int FACILITY_DAEMON = 3;

  private final SyslogDialer dialer;
  private final String tag;
  private final SyslogFormat format;
  private final JsonCodec codec;
  private volatile SyslogTransport transport;
  private volatile boolean closed;

  /**
   * Dials immediately.
   *
   * @param dialer opens transports to the collector
   * @param tag    syslog tag (APP-NAME)
   * @param format line format
   * @throws IOException if the first connection cannot be established
   */
  public SyslogOutput(SyslogDialer dialer, String tag, SyslogFormat format) throws IOException {
    this.dialer = Objects.requireNonNull(dialer, "dialer");
    this.tag = tag == null ? "" : tag;
    this.format = Objects.requireNonNull(format, "format");
    this.codec = JsonCodec.getDefault();
    try {
      this.transport = dialer.dial();
    } catch (IOException e) {
      throw new IOException("failed to connect to syslog " + dialer + ": " + e.getMessage(), e);
    }
  }

  /**
   * Builds the TLS context a target asks for, then connects.
   *
   * @param config a syslog target
   * @return a connected output
   * @throws IOException if TLS material is invalid or the collector is unreachable
   */
  public static SyslogOutput connect(TargetConfig config) throws IOException {
    boolean tls = config.tlsEnabled() || "tcp+tls".equals(config.protocol());
    SocketSyslogDialer dialer;
    if (tls) {
      SSLContext context = TlsContexts.build(config.tlsCa(), config.tlsCert(), config.tlsKey(),
          config.tlsSkipVerify());
      dialer = new SocketSyslogDialer(config.protocol(), config.host(), config.port(),
          context.getSocketFactory(), !config.tlsSkipVerify(),
          SocketSyslogDialer.DEFAULT_CONNECT_TIMEOUT_MS);
    } else {
      dialer = new SocketSyslogDialer(config.protocol(), config.host(), config.port(),
          null, false, SocketSyslogDialer.DEFAULT_CONNECT_TIMEOUT_MS);
    }
    return new SyslogOutput(dialer, config.tag(), SyslogFormat.fromValue(config.format()));
  }

  @Override
  public synchronized void write(LogEntry entry) throws IOException {
    SyslogTransport current = transport;
    if (closed || current == null) {
      throw new IOException("syslog connection is closed");
    }
    int priority = FACILITY_DAEMON * 8 + severityOf(entry.level().value());
    byte[] frame = format.render(priority, entry, tag, codec).getBytes(StandardCharsets.UTF_8);
    try {
      current.send(frame);
    } catch (IOException writeError) {
      closeQuietly(current, writeError);
      transport = null;
      if (closed) {
        throw new IOException("syslog connection is closed", writeError);
      }
      SyslogTransport redialed;
      try {
        redialed = dialer.dial();
      } catch (IOException dialError) {
        writeError.addSuppressed(dialError);
        throw new IOException("failed to write to syslog and reconnect failed", writeError);
      }
      transport = redialed;
      // close() may have run while dialing and missed the new transport
      if (closed) {
        transport = null;
        closeQuietly(redialed, writeError);
        throw new IOException("syslog connection is closed", writeError);
      }
      try {
        redialed.send(frame);
      } catch (IOException retryError) {
        transport = null;
        closeQuietly(redialed, retryError);
        if (closed) {
          throw new IOException("syslog connection is closed", retryError);
        }
        throw new IOException("failed to write to syslog after reconnect", retryError);
      }
      logger.log(Level.FINE, "Reconnected to syslog {0}", dialer);
    }
  }

  /**
   * Closes the connection without waiting for a write in progress. The blocked write
   * fails and no reconnect is attempted afterwards.
   */
  @Override
  public void close() throws IOException {
    closed = true;
    SyslogTransport current = transport;
    transport = null;
    if (current != null) {
      current.close();
    }
  }

  /**
   * Maps a level name onto a syslog severity.
   *
   * @param level level name
   * @return 7 for debug, 6 info, 5 notice, 4 warn/warning, 3 error, 2 fatal/panic,
   *     and 6 for anything else
   */
  public static int severityOf(String level) {
    if (level == null) {
      return 6;
    }
    switch (level) {
      case "debug":
        return 7;
      case "notice":
        return 5;
      case "warn":
      case "warning":
        return 4;
      case "error":
        return 3;
      case "fatal":
      case "panic":
        return 2;
      default:
        return 6;
    }
  }

  private static void closeQuietly(SyslogTransport broken, IOException cause) {
    try {
      broken.close();
    } catch (IOException e) {
      cause.addSuppressed(e);
    }
  }

  @Override
  public String toString() {
    return "SyslogOutput{" + dialer + ", format=" + format.value() + '}';
  }
}
