/**
 * Micrometer bridge for the adapter's {@link rqc.spi.MetricsExporter}.
 */
package rqc.micrometer;
