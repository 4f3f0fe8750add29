package io.sqltx;

import io.sqltx.spi.MetricsExporter;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Keeps the stack of ambient {@link TransactionScope}s for each logical flow.
 *
 * <p>The stack is an immutable chain of frames held in a {@link ThreadLocal}, so every
 * thread sees only its own scopes. A flow that continues on another thread carries its
 * stack there only through {@link #capture()}, and only when the innermost scope was
 * opened with {@linkplain ScopeOptions#asyncFlow() async flow} enabled.
 *
 * <p>{@link #global()} is the process-wide instance used by {@link Transactions} and by
 * {@link ConnectionFactory} unless another manager is configured.
 */
public final class AmbientScopeManager {
    private static final Logger logger = Logger.getLogger(AmbientScopeManager.class.getName());
    private static final AmbientScopeManager GLOBAL = new AmbientScopeManager();

    private final ThreadLocal<Frame> frames = new ThreadLocal<>();
    private final MetricsExporter metrics;

    public AmbientScopeManager() {
        this(MetricsExporter.NOOP);
    }

    /**
     * @param metrics exporter notified when ambient transactions start, finish and escalate
     */
    public AmbientScopeManager(MetricsExporter metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public static AmbientScopeManager global() {
        return GLOBAL;
    }

    /**
     * Opens a scope on the calling flow and makes it current.
     *
     * @throws IllegalArgumentException if a {@link Propagation#REQUIRED} scope asks for an
     *                                  isolation level different from the transaction it joins
     */
    public TransactionScope begin(ScopeOptions options) {
        Objects.requireNonNull(options, "options");
        Frame top = frames.get();
        AmbientTransaction outer = top == null ? null : top.scope().transaction();
        TransactionScope scope = switch (options.propagation()) {
            case SUPPRESS -> new TransactionScope(this, null, false, options);
            case REQUIRES_NEW -> newRoot(options);
            case REQUIRED -> outer == null ? newRoot(options) : join(outer, options);
        };
        push(scope);
        return scope;
    }

    /**
     * Returns the innermost ambient context of the calling flow; empty when there is none
     * or when the innermost scope suppresses ambient transactions.
     */
    public Optional<TransactionContext> current() {
        Frame top = frames.get();
        if (top == null || top.scope().transaction() == null) {
            return Optional.empty();
        }
        return Optional.of(top.scope());
    }

    /**
     * Returns the number of scopes open on the calling flow.
     */
    public int depth() {
        int depth = 0;
        for (Frame frame = frames.get(); frame != null; frame = frame.parent()) {
            depth++;
        }
        return depth;
    }

    /**
     * Captures the calling flow's stack for an asynchronous continuation.
     *
     * @return a snapshot that re-installs the stack on the continuation's thread if the
     *         innermost scope enables async flow, and does nothing otherwise
     */
    public FlowSnapshot capture() {
        Frame top = frames.get();
        if (top != null && top.scope().options().asyncFlow()) {
            return new FlowSnapshot(this, top);
        }
        return new FlowSnapshot(this, null);
    }

    void push(TransactionScope scope) {
        frames.set(new Frame(scope, frames.get()));
    }

    /**
     * Removes {@code scope}, which must be the innermost scope of the calling flow.
     *
     * @throws UnbalancedScopeException otherwise; every transaction on the flow is doomed first
     */
    void pop(TransactionScope scope) {
        Frame top = frames.get();
        if (top != null && top.scope() == scope) {
            install(top.parent());
            return;
        }
        for (Frame frame = top; frame != null; frame = frame.parent()) {
            AmbientTransaction transaction = frame.scope().transaction();
            if (transaction != null) {
                transaction.doom("ambient scopes were released out of order");
            }
        }
        Frame match = top;
        while (match != null && match.scope() != scope) {
            match = match.parent();
        }
        if (match == null) {
            String message = "Scope " + scope.id() + " is not open on thread " + Thread.currentThread().getName()
                    + "; scopes must be released on the flow that opened them";
            logger.severe(message);
            throw new UnbalancedScopeException(message);
        }
        UnbalancedScopeException failure = new UnbalancedScopeException("Scope " + scope.id()
                + " released while inner scope " + top.scope().id() + " is still open");
        install(match.parent());
        // inner roots would otherwise stay open until their owner closes them
        for (Frame frame = top; frame != match; frame = frame.parent()) {
            TransactionScope inner = frame.scope();
            inner.discard();
            if (inner.isRoot()) {
                try {
                    inner.transaction().finish(false);
                } catch (RuntimeException e) {
                    failure.addSuppressed(e);
                }
            }
        }
        logger.severe(failure.getMessage());
        throw failure;
    }

    AmbientTransaction currentTransaction() {
        Frame top = frames.get();
        return top == null ? null : top.scope().transaction();
    }

    Frame swap(Frame frame) {
        Frame previous = frames.get();
        install(frame);
        return previous;
    }

    private void install(Frame frame) {
        if (frame == null) {
            frames.remove();
        } else {
            frames.set(frame);
        }
    }

    private TransactionScope newRoot(ScopeOptions options) {
        IsolationLevel isolation = options.isolationLevel() == null
                ? IsolationLevel.READ_COMMITTED : options.isolationLevel();
        AmbientTransaction transaction = new AmbientTransaction(isolation, options.escalationPolicy(), metrics);
        return new TransactionScope(this, transaction, true, options);
    }

    private TransactionScope join(AmbientTransaction outer, ScopeOptions options) {
        if (options.isolationLevel() != null && options.isolationLevel() != outer.isolationLevel()) {
            throw new IllegalArgumentException("Nested scope requests " + options.isolationLevel()
                    + " but ambient transaction " + outer.id() + " runs at " + outer.isolationLevel());
        }
        return new TransactionScope(this, outer, false, options);
    }

    record Frame(TransactionScope scope, Frame parent) {
    }
}
