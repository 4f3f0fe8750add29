/**
 * Typed SQL commands: definitions with named, typed parameters and a result shape, bound to
 * a {@link io.sqltx.ConnectionHandle} and run synchronously or asynchronously.
 */
package io.sqltx.command;
