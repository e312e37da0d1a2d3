package deskgate.adapter.out.store;

import io.smallrye.mutiny.Uni;

import deskgate.core.model.admission.StoreHealth;
import deskgate.core.port.out.CounterStore;
import deskgate.core.port.out.CounterStoreException;

/**
 * Stands in for the shared store when no connection is configured.
 *
 * <p>Its health is permanently {@code UNCONFIGURED}, so admission fails open without ever
 * calling it. Any call that still arrives fails.
 */
public final class UnavailableCounterStore implements CounterStore {

    private final StoreHealth health = StoreHealth.unconfigured("unconfigured");

    @Override
    public Uni<Long> get(String counterId) {
        return unavailable("get");
    }

    @Override
    public Uni<Long> incrementWithExpiry(String counterId, long ttlSeconds) {
        return unavailable("increment");
    }

    @Override
    public Uni<Long> decrement(String counterId) {
        return unavailable("decrement");
    }

    @Override
    public StoreHealth health() {
        return health;
    }

    @Override
    public String name() {
        return "unconfigured";
    }

    private static Uni<Long> unavailable(String operation) {
        return Uni.createFrom().failure(new CounterStoreException(operation, "No counter store configured"));
    }
}
