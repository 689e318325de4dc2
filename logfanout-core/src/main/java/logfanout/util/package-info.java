/**
 * Shared helpers: daemon thread factory, dependency-free JSON encoding and the JSON
 * formatter for host log handlers.
 */
package logfanout.util;
