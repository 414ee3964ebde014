/**
 * Per-mode engine lifecycle: lazy construction, caching and disposal of connection pools.
 *
 * @see io.datascope.engine.AbstractEngineRegistry
 * @see io.datascope.DatabaseManager
 */
package io.datascope.engine;
