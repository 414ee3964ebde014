package io.datascope.engine;

/**
 * Lifecycle of the engine slot of one mode.
 *
 * <p>{@link #DISPOSED} behaves like {@link #UNINITIALIZED} for the next
 * {@link EngineRegistry#getEngine()}: a fresh engine is built.
 */
public enum EngineState {
    UNINITIALIZED,
    READY,
    DISPOSED
}
