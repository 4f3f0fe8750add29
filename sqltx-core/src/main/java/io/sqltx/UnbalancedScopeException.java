package io.sqltx;

/**
 * Programming error: ambient scopes were released out of LIFO order, or on a logical
 * flow that does not hold them.
 *
 * <p>Not recoverable. By the time this is thrown every transaction on the offending
 * flow has been doomed, so nothing enlisted there can commit.
 */
public final class UnbalancedScopeException extends IllegalStateException {
    public UnbalancedScopeException(String message) {
        super(message);
    }
}
