package io.sqltx.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.sqltx.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, a gauge and a distribution summary with a {@link MeterRegistry}
 * for export to Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code sqltx.tx.started} - transactions begun</li>
 *   <li>{@code sqltx.tx.committed} - transactions committed</li>
 *   <li>{@code sqltx.tx.rolledback} - transactions rolled back</li>
 *   <li>{@code sqltx.tx.escalated} - ambient transactions escalated to distributed</li>
 *   <li>{@code sqltx.command.executed} - commands that succeeded</li>
 *   <li>{@code sqltx.command.failed} - commands that failed</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code sqltx.tx.active} - transactions begun but not yet finished</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code sqltx.command.duration.ms} - command execution time</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter txStarted;
    private final Counter txCommitted;
    private final Counter txRolledBack;
    private final Counter txEscalated;
    private final Counter commandExecuted;
    private final Counter commandFailed;
    private final Gauge activeGauge;
    private final DistributionSummary commandDuration;

    private final AtomicInteger active = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "sqltx"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "sqltx");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "orders.db"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.txStarted = Counter.builder(namePrefix + ".tx.started")
                .description("Transactions begun (explicit or root ambient)")
                .register(registry);
        this.txCommitted = Counter.builder(namePrefix + ".tx.committed")
                .description("Transactions committed")
                .register(registry);
        this.txRolledBack = Counter.builder(namePrefix + ".tx.rolledback")
                .description("Transactions rolled back")
                .register(registry);
        this.txEscalated = Counter.builder(namePrefix + ".tx.escalated")
                .description("Ambient transactions escalated to distributed mode")
                .register(registry);
        this.commandExecuted = Counter.builder(namePrefix + ".command.executed")
                .description("Commands executed successfully")
                .register(registry);
        this.commandFailed = Counter.builder(namePrefix + ".command.failed")
                .description("Commands that failed")
                .register(registry);

        this.activeGauge = Gauge.builder(namePrefix + ".tx.active", active, AtomicInteger::get)
                .description("Transactions begun but not yet committed or rolled back")
                .register(registry);

        this.commandDuration = DistributionSummary.builder(namePrefix + ".command.duration.ms")
                .description("Command execution time in milliseconds")
                .register(registry);
    }

    @Override
    public void incrementTransactionStarted() {
        if (closed) return;
        txStarted.increment();
        active.incrementAndGet();
    }

    @Override
    public void incrementTransactionCommitted() {
        if (closed) return;
        txCommitted.increment();
        active.decrementAndGet();
    }

    @Override
    public void incrementTransactionRolledBack() {
        if (closed) return;
        txRolledBack.increment();
        active.decrementAndGet();
    }

    @Override
    public void incrementEscalated() {
        if (closed) return;
        txEscalated.increment();
    }

    @Override
    public void incrementCommandExecuted() {
        if (closed) return;
        commandExecuted.increment();
    }

    @Override
    public void incrementCommandFailed() {
        if (closed) return;
        commandFailed.increment();
    }

    @Override
    public void recordCommandDurationMs(long durationMs) {
        if (closed) return;
        commandDuration.record(durationMs);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(txStarted, txCommitted, txRolledBack, txEscalated,
                commandExecuted, commandFailed, activeGauge, commandDuration)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
