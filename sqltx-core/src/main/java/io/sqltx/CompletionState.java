package io.sqltx;

/**
 * Completion state of a {@link TransactionContext}.
 */
public enum CompletionState {
    ACTIVE,
    COMMITTED,
    ROLLED_BACK
}
