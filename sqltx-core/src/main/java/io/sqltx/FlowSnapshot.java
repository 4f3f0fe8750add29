package io.sqltx;

import java.util.function.Supplier;

/**
 * The ambient scope stack of one logical flow, captured for a continuation that may run
 * on another thread.
 *
 * <p>Obtained from {@link AmbientScopeManager#capture()}. A flowing snapshot installs the
 * captured stack on the worker thread for the duration of the wrapped task and restores
 * the worker's own stack afterwards. A non-flowing snapshot returns tasks unchanged.
 */
public final class FlowSnapshot {
    private final AmbientScopeManager manager;
    private final AmbientScopeManager.Frame frame;

    FlowSnapshot(AmbientScopeManager manager, AmbientScopeManager.Frame frame) {
        this.manager = manager;
        this.frame = frame;
    }

    /**
     * Returns {@code true} if wrapped tasks see the captured ambient context.
     */
    public boolean isFlowing() {
        return frame != null;
    }

    public <T> Supplier<T> wrap(Supplier<T> task) {
        if (frame == null) {
            return task;
        }
        return () -> {
            AmbientScopeManager.Frame previous = manager.swap(frame);
            try {
                return task.get();
            } finally {
                manager.swap(previous);
            }
        };
    }

    public Runnable wrap(Runnable task) {
        if (frame == null) {
            return task;
        }
        return () -> {
            AmbientScopeManager.Frame previous = manager.swap(frame);
            try {
                task.run();
            } finally {
                manager.swap(previous);
            }
        };
    }
}
