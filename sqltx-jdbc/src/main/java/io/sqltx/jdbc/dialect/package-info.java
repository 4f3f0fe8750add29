/**
 * Built-in dialects and the {@link io.sqltx.jdbc.dialect.Dialects} registry.
 */
package io.sqltx.jdbc.dialect;
