/**
 * Concrete outputs: {@link logfanout.output.SyslogOutput} for syslog collectors (TCP, UDP,
 * TLS; RFC 3164 and RFC 5424 framing) and {@link logfanout.output.HttpOutput} for batched
 * JSON delivery, created through an {@link logfanout.output.OutputFactory}.
 *
 * <p>Loggers in this package are never forwarded back into the dispatch hook.
 */
package logfanout.output;
