package io.sqltx;

import java.util.Objects;

/**
 * Options for opening an ambient {@link TransactionScope}.
 *
 * @param isolationLevel   isolation of a newly started transaction; {@code null} inherits the
 *                         outer transaction when joining one and otherwise means
 *                         {@link IsolationLevel#READ_COMMITTED}
 * @param asyncFlow        whether the scope follows asynchronous continuations onto other threads
 * @param propagation      relation to the transaction already current on the flow
 * @param escalationPolicy reaction to a second concurrently open physical connection
 */
public record ScopeOptions(
        IsolationLevel isolationLevel,
        boolean asyncFlow,
        Propagation propagation,
        EscalationPolicy escalationPolicy
) {
    private static final ScopeOptions DEFAULTS =
            new ScopeOptions(null, false, Propagation.REQUIRED, EscalationPolicy.ALLOW);

    public ScopeOptions {
        Objects.requireNonNull(propagation, "propagation");
        Objects.requireNonNull(escalationPolicy, "escalationPolicy");
    }

    /**
     * Returns the defaults: inherited isolation, no async flow, {@link Propagation#REQUIRED},
     * {@link EscalationPolicy#ALLOW}.
     */
    public static ScopeOptions defaults() {
        return DEFAULTS;
    }

    public ScopeOptions withIsolationLevel(IsolationLevel isolationLevel) {
        return new ScopeOptions(isolationLevel, asyncFlow, propagation, escalationPolicy);
    }

    public ScopeOptions withAsyncFlow(boolean asyncFlow) {
        return new ScopeOptions(isolationLevel, asyncFlow, propagation, escalationPolicy);
    }

    public ScopeOptions withPropagation(Propagation propagation) {
        return new ScopeOptions(isolationLevel, asyncFlow, propagation, escalationPolicy);
    }

    public ScopeOptions withEscalationPolicy(EscalationPolicy escalationPolicy) {
        return new ScopeOptions(isolationLevel, asyncFlow, propagation, escalationPolicy);
    }
}
