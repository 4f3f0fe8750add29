/**
 * Pending row mutations for a table and their all-or-nothing application as JDBC batches
 * or multi-row inserts.
 *
 * @see io.sqltx.jdbc.table.TableChangeSet
 */
package io.sqltx.jdbc.table;
