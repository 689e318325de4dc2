/**
 * Dynamic multi-target log dispatch.
 *
 * <p>{@link logfanout.TargetManager} reconciles live {@link logfanout.Output}s with the
 * configured logging targets; its {@link logfanout.dispatch.DispatchHook} fans every
 * {@link logfanout.LogEntry} out to them without taking the manager's lock.
 */
package logfanout;
