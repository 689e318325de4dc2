/**
 * Service provider interfaces: target persistence, settings, JDBC connections and metrics.
 *
 * @see logfanout.spi.TargetStore
 * @see logfanout.spi.SettingsReader
 * @see logfanout.spi.MetricsExporter
 */
package logfanout.spi;
