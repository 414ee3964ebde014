package io.datascope;

import io.datascope.engine.EngineHandle;
import io.datascope.engine.EngineRegistry;
import io.datascope.engine.EngineState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-wide facade over the per-mode engine registries.
 *
 * <p>Construct once at startup with the registries of the modes the application uses and
 * close it at shutdown:
 * <pre>{@code
 * try (DatabaseManager manager = DatabaseManager.builder()
 *         .registry(new JdbcEngineRegistry(config))
 *         .registry(new R2dbcEngineRegistry(config))
 *         .build()) {
 *     EngineHandle engine = manager.getEngine(Mode.BLOCKING);
 *     ...
 * }
 * }</pre>
 */
public final class DatabaseManager implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(DatabaseManager.class.getName());

    private final Map<Mode, EngineRegistry<?>> registries;

    private DatabaseManager(Map<Mode, EngineRegistry<?>> registries) {
        this.registries = Collections.unmodifiableMap(new EnumMap<>(registries));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the engine of the given mode, building it on first use.
     *
     * @throws IllegalArgumentException if no registry was configured for the mode
     */
    public EngineHandle getEngine(Mode mode) {
        return registry(mode).getEngine();
    }

    /**
     * Returns the registry of the given mode.
     *
     * @throws IllegalArgumentException if no registry was configured for the mode
     */
    public EngineRegistry<?> registry(Mode mode) {
        Objects.requireNonNull(mode, "mode");
        EngineRegistry<?> registry = registries.get(mode);
        if (registry == null) {
            throw new IllegalArgumentException("No engine registry configured for mode " + mode);
        }
        return registry;
    }

    public boolean supports(Mode mode) {
        return registries.containsKey(mode);
    }

    public void dispose(Mode mode) {
        registry(mode).dispose();
    }

    /**
     * Disposes every configured mode. A failure in one mode does not prevent the others.
     */
    public void disposeAll() {
        for (EngineRegistry<?> registry : registries.values()) {
            try {
                registry.dispose();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Failed to dispose " + registry.mode() + " engine", e);
            }
        }
    }

    public EngineState state(Mode mode) {
        return registry(mode).state();
    }

    /**
     * Same as {@link #disposeAll()}.
     */
    @Override
    public void close() {
        disposeAll();
    }

    public static final class Builder {
        private final Map<Mode, EngineRegistry<?>> registries = new EnumMap<>(Mode.class);

        private Builder() {
        }

        public Builder registry(EngineRegistry<?> registry) {
            Objects.requireNonNull(registry, "registry");
            if (registries.putIfAbsent(registry.mode(), registry) != null) {
                throw new IllegalStateException("Registry already configured for mode " + registry.mode());
            }
            return this;
        }

        public DatabaseManager build() {
            if (registries.isEmpty()) {
                throw new IllegalStateException("At least one engine registry is required");
            }
            return new DatabaseManager(registries);
        }
    }
}
