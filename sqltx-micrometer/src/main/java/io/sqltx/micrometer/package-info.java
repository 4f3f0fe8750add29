/**
 * Micrometer bridge for {@link io.sqltx.spi.MetricsExporter}.
 *
 * <pre>{@code
 * var metrics = new MicrometerMetricsExporter(meterRegistry);
 * ConnectionFactory factory = ConnectionFactory.builder()
 *     .connectionProvider(dataSource::getConnection)
 *     .metrics(metrics)
 *     .build();
 * }</pre>
 */
package io.sqltx.micrometer;
