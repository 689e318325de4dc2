package logfanout.output;

import java.io.Closeable;
import java.io.IOException;

/**
 * One open connection to a syslog collector: a TCP or TLS stream, or a connected UDP
 * socket. {@link SyslogOutput} serializes sends; {@link #close()} may be called from
 * another thread while a send is blocked and must make that send fail.
 */
public interface SyslogTransport extends Closeable {

  /**
   * Sends one complete frame.
   *
   * @param frame encoded syslog frame including the trailing newline
   * @throws IOException if the connection is broken
   */
  void send(byte[] frame) throws IOException;
}
