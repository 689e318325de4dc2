package logfanout.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by
 * {@link logfanout.jdbc.store.AbstractJdbcTargetStore} and its subclasses.
 */
public final class TargetStoreException extends RuntimeException {
  public TargetStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
