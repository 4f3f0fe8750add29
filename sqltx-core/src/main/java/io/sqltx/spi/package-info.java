/**
 * Service provider interfaces for the collaborators the transaction layer consumes:
 * {@link io.sqltx.spi.ConnectionProvider} for physical connections and
 * {@link io.sqltx.spi.MetricsExporter} for observability.
 */
package io.sqltx.spi;
