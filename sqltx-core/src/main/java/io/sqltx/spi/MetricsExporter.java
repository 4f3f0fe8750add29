package io.sqltx.spi;

/**
 * Observability hook for exporting transaction and command counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of transactions begun (explicit or root ambient).
     */
    void incrementTransactionStarted();

    /**
     * Increments the count of transactions that committed.
     */
    void incrementTransactionCommitted();

    /**
     * Increments the count of transactions that rolled back, including automatic
     * rollback on release.
     */
    void incrementTransactionRolledBack();

    /**
     * Increments the count of ambient transactions escalated to distributed mode.
     */
    void incrementEscalated();

    /**
     * Increments the count of commands that completed successfully.
     */
    void incrementCommandExecuted();

    /**
     * Increments the count of commands that failed.
     */
    void incrementCommandFailed();

    /**
     * Records the time spent executing one command, including result materialization
     * for eager result shapes.
     *
     * @param durationMs execution time in milliseconds (always non-negative)
     */
    default void recordCommandDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementTransactionStarted() {
        }

        @Override
        public void incrementTransactionCommitted() {
        }

        @Override
        public void incrementTransactionRolledBack() {
        }

        @Override
        public void incrementEscalated() {
        }

        @Override
        public void incrementCommandExecuted() {
        }

        @Override
        public void incrementCommandFailed() {
        }
    }
}
