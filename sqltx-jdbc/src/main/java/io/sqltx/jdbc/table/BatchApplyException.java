package io.sqltx.jdbc.table;

import io.sqltx.SqlTxException;

import java.sql.SQLException;

/**
 * Thrown when a batch of row mutations fails. The whole batch has been rolled back, so
 * {@link #appliedCount()} is always zero and every mutation is still pending.
 */
public final class BatchApplyException extends SqlTxException {
    private final int failedIndex;

    public BatchApplyException(String message, int failedIndex, SQLException cause) {
        super(message, cause);
        this.failedIndex = failedIndex;
    }

    /**
     * Number of mutations left applied in the database.
     */
    public int appliedCount() {
        return 0;
    }

    /**
     * Position in the pending list of the mutation the database rejected, or {@code -1} if
     * the driver did not report it.
     */
    public int failedIndex() {
        return failedIndex;
    }
}
