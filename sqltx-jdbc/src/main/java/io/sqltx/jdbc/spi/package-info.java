/**
 * Service provider interface for database dialects.
 *
 * @see io.sqltx.jdbc.spi.Dialect
 */
package io.sqltx.jdbc.spi;
