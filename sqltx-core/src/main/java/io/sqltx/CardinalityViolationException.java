package io.sqltx;

/**
 * Thrown when a single-row command returns more than one row.
 */
public final class CardinalityViolationException extends SqlTxException {
    public CardinalityViolationException(String message) {
        super(message);
    }
}
