/**
 * Plain JDBC integration: connection providers, connection strings with the {@code Enlist}
 * option, and factories for {@link io.sqltx.ConnectionFactory}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li>{@link io.sqltx.jdbc.spi} - dialect SPI</li>
 *   <li>{@link io.sqltx.jdbc.dialect} - H2, MySQL, PostgreSQL dialects and the registry</li>
 *   <li>{@link io.sqltx.jdbc.table} - batch reconciler</li>
 * </ul>
 */
package io.sqltx.jdbc;
