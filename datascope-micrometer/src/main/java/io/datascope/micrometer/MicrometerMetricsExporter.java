package io.datascope.micrometer;

import io.datascope.Mode;
import io.datascope.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Every meter carries a {@code mode} tag ({@code blocking} or {@code non_blocking}).
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code datascope.engine.created}: engines built</li>
 *   <li>{@code datascope.engine.disposed}: engines disposed</li>
 *   <li>{@code datascope.session.opened}: sessions handed out</li>
 *   <li>{@code datascope.session.committed}: transactions committed</li>
 *   <li>{@code datascope.session.rolled_back}: transactions rolled back</li>
 *   <li>{@code datascope.pool.exhausted}: acquisitions that timed out</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code datascope.session.open}: sessions currently open</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Map<Mode, ModeMeters> meters = new EnumMap<>(Mode.class);
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "datascope"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "datascope");
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
        for (Mode mode : Mode.values()) {
            meters.put(mode, new ModeMeters(registry, namePrefix, mode));
        }
    }

    @Override
    public void incrementEngineCreated(Mode mode) {
        if (closed) return;
        meters.get(mode).engineCreated.increment();
    }

    @Override
    public void incrementEngineDisposed(Mode mode) {
        if (closed) return;
        meters.get(mode).engineDisposed.increment();
    }

    @Override
    public void incrementSessionOpened(Mode mode) {
        if (closed) return;
        meters.get(mode).sessionOpened.increment();
    }

    @Override
    public void incrementCommitted(Mode mode) {
        if (closed) return;
        meters.get(mode).committed.increment();
    }

    @Override
    public void incrementRolledBack(Mode mode) {
        if (closed) return;
        meters.get(mode).rolledBack.increment();
    }

    @Override
    public void incrementPoolExhausted(Mode mode) {
        if (closed) return;
        meters.get(mode).poolExhausted.increment();
    }

    @Override
    public void recordOpenSessions(Mode mode, int openSessions) {
        if (closed) return;
        meters.get(mode).openSessions.set(openSessions);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this when the engines are disposed for good to prevent stale gauges.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (ModeMeters modeMeters : meters.values()) {
            for (Meter meter : modeMeters.all()) {
                try {
                    registry.remove(meter);
                } catch (RuntimeException e) {
                    if (first == null) first = e; else first.addSuppressed(e);
                }
            }
        }
        if (first != null) throw first;
    }

    static String tagValue(Mode mode) {
        return mode.name().toLowerCase(Locale.ROOT);
    }

    private static final class ModeMeters {
        final Counter engineCreated;
        final Counter engineDisposed;
        final Counter sessionOpened;
        final Counter committed;
        final Counter rolledBack;
        final Counter poolExhausted;
        final AtomicInteger openSessions = new AtomicInteger();
        final Gauge openSessionsGauge;

        ModeMeters(MeterRegistry registry, String prefix, Mode mode) {
            String tag = tagValue(mode);
            this.engineCreated = Counter.builder(prefix + ".engine.created")
                .description("Engines built")
                .tag("mode", tag)
                .register(registry);
            this.engineDisposed = Counter.builder(prefix + ".engine.disposed")
                .description("Engines disposed")
                .tag("mode", tag)
                .register(registry);
            this.sessionOpened = Counter.builder(prefix + ".session.opened")
                .description("Sessions handed out by the pool")
                .tag("mode", tag)
                .register(registry);
            this.committed = Counter.builder(prefix + ".session.committed")
                .description("Transactions committed")
                .tag("mode", tag)
                .register(registry);
            this.rolledBack = Counter.builder(prefix + ".session.rolled_back")
                .description("Transactions rolled back")
                .tag("mode", tag)
                .register(registry);
            this.poolExhausted = Counter.builder(prefix + ".pool.exhausted")
                .description("Session requests that timed out waiting for a connection")
                .tag("mode", tag)
                .register(registry);
            this.openSessionsGauge = Gauge.builder(prefix + ".session.open", openSessions, AtomicInteger::get)
                .description("Sessions currently open")
                .tag("mode", tag)
                .register(registry);
        }

        List<Meter> all() {
            List<Meter> all = new ArrayList<>();
            all.add(engineCreated);
            all.add(engineDisposed);
            all.add(sessionOpened);
            all.add(committed);
            all.add(rolledBack);
            all.add(poolExhausted);
            all.add(openSessionsGauge);
            return all;
        }
    }
}
