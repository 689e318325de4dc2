/**
 * Lock-free fan-out of log entries: the {@link logfanout.dispatch.DispatchHook} handler,
 * the immutable {@link logfanout.dispatch.DispatchSnapshot} it reads, and the per-target
 * {@link logfanout.dispatch.QueuedOutput} queues.
 */
package logfanout.dispatch;
