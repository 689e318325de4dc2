/**
 * Micrometer bridge for exporting dispatch metrics to Prometheus, Grafana, and other backends.
 *
 * @see logfanout.micrometer.MicrometerMetricsExporter
 */
package logfanout.micrometer;
