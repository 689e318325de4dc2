package logfanout;

import java.io.Closeable;
import java.io.IOException;

/**
 * A live log destination backing one enabled target.
 *
 * <p>Implementations must not block indefinitely in {@link #write} and must tolerate a
 * second {@link #close}. Entries with missing fields are rendered without them rather
 * than rejected.
 *
 * @see logfanout.output.SyslogOutput
 * @see logfanout.output.HttpOutput
 */
public interface Output extends Closeable {

  /**
   * Delivers or buffers one entry.
   *
   * @param entry the entry to write
   * @throws IOException if the entry could not be delivered
   */
  void write(LogEntry entry) throws IOException;

  /**
   * Writes one entry and waits until it has been delivered, so that delivery errors
   * reach the caller. Used to test a target before it is saved.
   *
   * <p>Defaults to {@link #write}; buffering outputs override it.
   *
   * @param entry the entry to deliver
   * @throws IOException if the entry could not be delivered
   */
  default void probe(LogEntry entry) throws IOException {
    write(entry);
  }

  /**
   * Releases sockets, timers and threads held by this output.
   *
   * @throws IOException if the underlying resource fails to close
   */
  @Override
  void close() throws IOException;
}
