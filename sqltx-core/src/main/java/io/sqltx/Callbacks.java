package io.sqltx;

import java.util.List;

final class Callbacks {

    /**
     * Runs every callback even if earlier ones fail. Returns the first failure with later
     * ones suppressed, or {@code null}.
     */
    static RuntimeException runAll(List<Runnable> callbacks) {
        RuntimeException first = null;
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        return first;
    }

    private Callbacks() {}
}
