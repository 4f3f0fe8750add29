package io.sqltx;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Work performed against the physical connection of a {@link ConnectionHandle} once
 * enlistment has been validated.
 *
 * @param <T> the result type
 * @see ConnectionHandle#execute(TransactionContext, ConnectionCallback)
 */
@FunctionalInterface
public interface ConnectionCallback<T> {
    T doInConnection(Connection connection) throws SQLException;
}
