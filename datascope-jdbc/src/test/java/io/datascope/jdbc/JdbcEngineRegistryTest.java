package io.datascope.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import io.datascope.DataScopeConfig;
import io.datascope.EngineConstructionException;
import io.datascope.Mode;
import io.datascope.UnsupportedSchemeException;
import io.datascope.engine.EngineState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JdbcEngineRegistryTest {
    private JdbcEngineRegistry registry;

    private static DataScopeConfig config() {
        return new DataScopeConfig()
            .setUrl("h2:///mem:registry_" + UUID.randomUUID())
            .setPoolSize(2)
            .setMaxOverflow(3)
            .setAcquireTimeout(Duration.ofMillis(500));
    }

    @AfterEach
    void tearDown() {
        if (registry != null) {
            registry.dispose();
        }
    }

    @Test
    void buildsHikariPoolFromConfig() {
        registry = new JdbcEngineRegistry(config());

        JdbcEngine engine = registry.getEngine();

        assertEquals(Mode.BLOCKING, engine.mode());
        assertEquals(2, engine.poolSize());
        assertEquals(3, engine.maxOverflow());
        assertEquals(Duration.ofMillis(500), engine.acquireTimeout());
        assertTrue(engine.url().startsWith("jdbc:h2:mem:registry_"));
        assertEquals("h2", engine.dialect().name());

        HikariDataSource hikari = (HikariDataSource) engine.dataSource();
        assertEquals(5, hikari.getMaximumPoolSize());
        assertEquals(2, hikari.getMinimumIdle());
        assertEquals(500, hikari.getConnectionTimeout());
        assertFalse(hikari.isAutoCommit());
    }

    @Test
    void acquireTimeoutBelowHikariFloorIsRaised() {
        registry = new JdbcEngineRegistry(config().setAcquireTimeout(Duration.ofMillis(10)));

        HikariDataSource hikari = (HikariDataSource) registry.getEngine().dataSource();

        assertEquals(JdbcEngineRegistry.MIN_CONNECTION_TIMEOUT_MS, hikari.getConnectionTimeout());
    }

    @Test
    void acceptsNonBlockingFormOfUrl() {
        registry = new JdbcEngineRegistry(config().setUrl("h2+r2dbc:///mem:either_" + UUID.randomUUID()));

        assertTrue(registry.getEngine().url().startsWith("jdbc:h2:mem:either_"));
    }

    @Test
    void concurrentFirstCallersGetSameEngine() throws Exception {
        registry = new JdbcEngineRegistry(config());
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<JdbcEngine>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return registry.getEngine();
                }));
            }
            start.countDown();

            Set<JdbcEngine> engines = new HashSet<>();
            for (Future<JdbcEngine> future : futures) {
                engines.add(future.get(10, TimeUnit.SECONDS));
            }
            assertEquals(1, engines.size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void disposeClosesPoolAndNextCallRebuilds() {
        registry = new JdbcEngineRegistry(config());
        JdbcEngine first = registry.getEngine();

        registry.dispose();

        assertTrue(first.isClosed());
        assertEquals(EngineState.DISPOSED, registry.state());
        assertThrows(IllegalStateException.class, first::openSession);

        JdbcEngine second = registry.getEngine();
        assertNotSame(first, second);
        assertFalse(second.isClosed());
        registry.dispose();
        assertDoesNotThrow(registry::dispose);
    }

    @Test
    void unsupportedSchemeIsNotWrapped() {
        registry = new JdbcEngineRegistry(config().setUrl("ftp://files.local/db"));

        assertThrows(UnsupportedSchemeException.class, registry::getEngine);
        assertEquals(EngineState.UNINITIALIZED, registry.state());
    }

    @Test
    void unreachableDatabaseFailsConstructionAndStaysRetryable() {
        DataScopeConfig config = config().setUrl("h2://127.0.0.1:1/nowhere");
        registry = new JdbcEngineRegistry(config);

        EngineConstructionException ex = assertThrows(EngineConstructionException.class, registry::getEngine);
        assertEquals(Mode.BLOCKING, ex.mode());
        assertEquals(EngineState.UNINITIALIZED, registry.state());

        config.setUrl("h2:///mem:recovered_" + UUID.randomUUID());
        assertNotNull(registry.getEngine());
        assertEquals(EngineState.READY, registry.state());
    }

    @Test
    void malformedUrlFailsConstruction() {
        registry = new JdbcEngineRegistry(config().setUrl("postgresql:///no-host"));

        assertThrows(EngineConstructionException.class, registry::getEngine);
    }
}
