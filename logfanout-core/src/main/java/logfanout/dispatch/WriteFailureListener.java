package logfanout.dispatch;

/**
 * Notified on the worker thread when an output rejects an entry.
 */
@FunctionalInterface
public interface WriteFailureListener {

  /**
   * @param targetId id of the target whose output failed
   * @param failure  the write error
   */
  void onWriteFailure(String targetId, Exception failure);
}
