package io.datascope.r2dbc;

import io.datascope.DataScopeConfig;
import io.datascope.engine.AbstractEngineRegistry;
import io.datascope.engine.EngineState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class R2dbcEngineLifecycleTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final RecordingMetrics metrics = new RecordingMetrics();
    private R2dbcEngineRegistry registry;
    private R2dbcScopes scopes;

    @BeforeEach
    void setUp() {
        registry = new R2dbcEngineRegistry(new DataScopeConfig()
            .setUrl("h2:///mem:r2life_" + UUID.randomUUID().toString().replace("-", ""))
            .setPoolSize(2)
            .setMaxOverflow(0), metrics);
        scopes = new R2dbcScopes(registry);
        scopes.withTransaction(s -> s.execute("CREATE TABLE item (id INT PRIMARY KEY)")).block(TIMEOUT);
    }

    @AfterEach
    void tearDown() {
        registry.dispose();
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within " + TIMEOUT);
            }
            Thread.sleep(10);
        }
    }

    @Test
    void readOnlyBareScopeIsNotCountedAsRollback() {
        int before = metrics.rolledBack.get();

        List<Integer> ids = scopes.inSession(s -> s.query("SELECT id FROM item", (row, meta) -> row.get(0, Integer.class)))
            .collectList().block(TIMEOUT);

        assertEquals(List.of(), ids);
        assertEquals(before, metrics.rolledBack.get());
    }

    @Test
    void discardedWritesAreCountedAsRollback() {
        int before = metrics.rolledBack.get();

        scopes.withSession(s -> s.update("INSERT INTO item VALUES ($1)", 1)).block(TIMEOUT);

        assertEquals(before + 1, metrics.rolledBack.get());
    }

    @Test
    void disposeOnNonBlockingThreadClosesPoolWithoutWarning() throws InterruptedException {
        R2dbcEngine engine = registry.getEngine();
        Logger registryLogger = Logger.getLogger(AbstractEngineRegistry.class.getName());
        List<LogRecord> warnings = new CopyOnWriteArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                if (record.getLevel().intValue() >= Level.WARNING.intValue()) {
                    warnings.add(record);
                }
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        registryLogger.addHandler(handler);
        try {
            Mono.fromRunnable(registry::dispose).subscribeOn(Schedulers.parallel()).block(TIMEOUT);
        } finally {
            registryLogger.removeHandler(handler);
        }

        assertEquals(List.of(), warnings);
        assertEquals(EngineState.DISPOSED, registry.state());
        await(engine::isClosed);
    }

    @Test
    void staleSessionDoesNotOverwriteGaugeOfRebuiltEngine() {
        R2dbcSession stale = scopes.openSession().block(TIMEOUT);
        registry.dispose();

        R2dbcSession fresh = scopes.openSession().block(TIMEOUT);
        assertEquals(1, metrics.lastOpenSessions);

        stale.close().onErrorResume(e -> Mono.empty()).block(TIMEOUT);
        assertFalse(stale.isOpen());
        assertEquals(1, metrics.lastOpenSessions);

        fresh.close().block(TIMEOUT);
        assertEquals(0, metrics.lastOpenSessions);
    }
}
