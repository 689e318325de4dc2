package logfanout.output;

import java.io.IOException;

/**
 * Opens a fresh {@link SyslogTransport}. Called once on construction and once per
 * reconnect attempt, always with the same parameters.
 */
@FunctionalInterface
public interface SyslogDialer {
  SyslogTransport dial() throws IOException;
}
