package com.projectcontext.core.registry;

import com.projectcontext.core.model.Registry;

import java.util.function.Supplier;

/**
 * Durable store of the project registry.
 *
 * <p>{@link #load()} is lock-free and always returns a complete snapshot.
 * Compound read-modify-write sequences must run inside {@link #withLock(Supplier)}
 * so that two writers never interleave; across processes the last writer wins.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * store.withLock(() -> {
 *     Registry registry = store.load();
 *     store.save(registry.withActive("api", registry.activeProjectId()));
 *     return null;
 * });
 * }</pre>
 */
public interface RegistryStore {

    /**
     * Loads the current registry.
     *
     * @return registry, empty if nothing has been persisted yet
     * @throws CorruptRegistryException if the persisted state cannot be parsed
     * @throws UnsupportedRegistryVersionException if it was written by a newer schema
     */
    Registry load();

    /**
     * Atomically replaces the persisted registry.
     *
     * @param registry new registry
     * @throws RegistryInvariantViolationException if the registry breaks an invariant;
     *         nothing is written in that case
     */
    void save(Registry registry);

    /**
     * Runs {@code action} with exclusive access to the store.
     *
     * <p>The lock is re-entrant for the calling thread and released on every exit
     * path, including exceptions thrown by {@code action}.
     *
     * @param action action to run
     * @param <T> result type
     * @return result of {@code action}
     */
    <T> T withLock(Supplier<T> action);
}
