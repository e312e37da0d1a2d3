package deskgate.adapter.out.store.memory;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;

import deskgate.core.model.admission.StoreHealth;
import deskgate.core.port.out.CounterStore;

/**
 * In-memory counter store.
 *
 * <p>Stores counters in a concurrent hash map; every mutation is a single atomic
 * {@code compute}. Suitable for single-instance deployments and tests.
 *
 * <p>Limitations:
 * <ul>
 *   <li>Counters are not shared across instances</li>
 *   <li>Counters are lost on restart</li>
 * </ul>
 *
 * <p>Expired counters read as absent and are swept periodically when a sweep interval is given.
 */
public final class InMemoryCounterStore implements CounterStore {

    private record Entry(long count, long expiresAtMs) {

        boolean expiredAt(long nowMs) {
            return nowMs >= expiresAtMs;
        }
    }

    private final ConcurrentMap<String, Entry> counters = new ConcurrentHashMap<>();
    private final Clock clock;
    private final StoreHealth health = StoreHealth.up("memory");
    private final ScheduledExecutorService sweeper;

    /**
     * Creates a store without background sweeping.
     *
     * @param clock the clock used for expiry
     */
    public InMemoryCounterStore(Clock clock) {
        this.clock = clock;
        this.sweeper = null;
    }

    /**
     * Creates a store that removes expired counters every {@code sweepIntervalSeconds}.
     *
     * @param clock the clock used for expiry
     * @param sweepIntervalSeconds the sweep period
     */
    public InMemoryCounterStore(Clock clock, long sweepIntervalSeconds) {
        this.clock = clock;
        this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            final var thread = new Thread(r, "deskgate-counter-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        this.sweeper.scheduleAtFixedRate(this::sweep, sweepIntervalSeconds, sweepIntervalSeconds, TimeUnit.SECONDS);
    }

    @Override
    public Uni<Long> get(String counterId) {
        final var entry = counters.get(counterId);
        final var nowMs = clock.millis();
        return Uni.createFrom().item(entry == null || entry.expiredAt(nowMs) ? 0L : entry.count());
    }

    @Override
    public Uni<Long> incrementWithExpiry(String counterId, long ttlSeconds) {
        final var nowMs = clock.millis();
        final var expiresAtMs = nowMs + TimeUnit.SECONDS.toMillis(ttlSeconds);
        final var updated = counters.compute(counterId, (id, current) -> {
            if (current == null || current.expiredAt(nowMs)) {
                return new Entry(1, expiresAtMs);
            }
            return new Entry(current.count() + 1, expiresAtMs);
        });
        return Uni.createFrom().item(updated.count());
    }

    @Override
    public Uni<Long> decrement(String counterId) {
        final var nowMs = clock.millis();
        final var updated = counters.computeIfPresent(counterId, (id, current) -> {
            if (current.expiredAt(nowMs)) {
                return null;
            }
            return new Entry(Math.max(0, current.count() - 1), current.expiresAtMs());
        });
        return Uni.createFrom().item(updated == null ? 0L : updated.count());
    }

    @Override
    public StoreHealth health() {
        return health;
    }

    @Override
    public String name() {
        return "memory";
    }

    /**
     * Returns the number of counters currently held, expired or not.
     *
     * @return the counter count
     */
    public int size() {
        return counters.size();
    }

    /**
     * Removes every expired counter.
     */
    public void sweep() {
        final var nowMs = clock.millis();
        counters.entrySet().removeIf(e -> e.getValue().expiredAt(nowMs));
    }

    /**
     * Stops the background sweep.
     */
    public void shutdown() {
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
    }
}
