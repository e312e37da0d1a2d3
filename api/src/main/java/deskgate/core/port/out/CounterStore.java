package deskgate.core.port.out;

import io.smallrye.mutiny.Uni;

import deskgate.core.model.admission.StoreHealth;

/**
 * Port for the shared key/value store that holds window counters.
 *
 * <p>Implementations must make {@link #incrementWithExpiry} a single atomic unit so a
 * counter is never left without a TTL. Failures are signalled by a failed {@link Uni};
 * callers decide whether to fail open.
 */
public interface CounterStore {

    /**
     * Read the current value of a counter.
     *
     * @param counterId the counter identifier
     * @return the value, 0 when the counter does not exist
     */
    Uni<Long> get(String counterId);

    /**
     * Atomically increment a counter and set its expiry.
     *
     * @param counterId the counter identifier
     * @param ttlSeconds expiry applied together with the increment
     * @return the value after incrementing
     */
    Uni<Long> incrementWithExpiry(String counterId, long ttlSeconds);

    /**
     * Decrement an existing counter. A counter that has already expired is left absent.
     *
     * @param counterId the counter identifier
     * @return the value after decrementing, or 0 if the counter no longer exists
     */
    Uni<Long> decrement(String counterId);

    /**
     * Connectivity state of the store, owned by the implementation.
     *
     * @return the health handle
     */
    StoreHealth health();

    /**
     * Name used in logs and metric tags.
     *
     * @return the store name
     */
    String name();
}
