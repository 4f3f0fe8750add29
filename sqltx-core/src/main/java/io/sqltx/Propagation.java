package io.sqltx;

/**
 * How a new ambient scope relates to the transaction already current on the logical flow.
 */
public enum Propagation {
    /** Join the current ambient transaction, or start one if there is none. */
    REQUIRED,
    /** Always start an independent transaction; the outer one is hidden until release. */
    REQUIRES_NEW,
    /** Run without an ambient transaction; connections opened inside do not enlist. */
    SUPPRESS
}
