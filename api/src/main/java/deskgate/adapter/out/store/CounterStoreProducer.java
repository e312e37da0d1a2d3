package deskgate.adapter.out.store;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.redis.client.Redis;
import io.vertx.redis.client.RedisOptions;
import org.jboss.logging.Logger;

import deskgate.adapter.out.store.memory.InMemoryCounterStore;
import deskgate.adapter.out.store.redis.RedisCounterStore;
import deskgate.core.config.AdmissionConfig;
import deskgate.core.port.out.CounterStore;

/**
 * CDI producer for the counter store.
 *
 * <p>Selects the implementation based on configuration:
 * <ul>
 *   <li>MEMORY - in-process counters, single instance only</li>
 *   <li>REDIS with a URL - the shared store</li>
 *   <li>REDIS without a URL, or a URL the client rejects - an unconfigured store, so every
 *       admission check fails open instead of the process failing to start</li>
 * </ul>
 */
@ApplicationScoped
public class CounterStoreProducer {

    private static final Logger LOG = Logger.getLogger(CounterStoreProducer.class);
    private static final long SWEEP_INTERVAL_SECONDS = 60;

    private final AdmissionConfig config;
    private final Vertx vertx;
    private final Clock clock;

    @Inject
    public CounterStoreProducer(AdmissionConfig config, Vertx vertx, Clock clock) {
        this.config = config;
        this.vertx = vertx;
        this.clock = clock;
    }

    /**
     * Produces the counter store for CDI injection.
     *
     * @return the configured counter store
     */
    @Produces
    @ApplicationScoped
    public CounterStore produceCounterStore() {
        if (config.store() == AdmissionConfig.StoreType.MEMORY) {
            LOG.info("Using in-memory counter store; limits are not shared between instances");
            return new InMemoryCounterStore(clock, SWEEP_INTERVAL_SECONDS);
        }

        final var url = config.redis().url().filter(u -> !u.isBlank());
        if (url.isEmpty()) {
            LOG.warn("No Redis URL configured (REDIS_URL), admission control fails open for every request");
            return new UnavailableCounterStore();
        }

        try {
            final var redis = Redis.createClient(vertx, new RedisOptions().setConnectionString(url.get()));
            LOG.infov("Using Redis counter store, timeout {0}", config.redis().timeout());
            return new RedisCounterStore(
                    redis, vertx, config.redis().timeout(), config.redis().probeInterval());
        } catch (RuntimeException e) {
            LOG.warnv("Failed to initialize Redis counter store, admission control fails open: {0}", e.getMessage());
            return new UnavailableCounterStore();
        }
    }

    /**
     * Disposes the counter store, stopping timers and connections.
     */
    void disposeCounterStore(@Disposes CounterStore store) {
        if (store instanceof InMemoryCounterStore memory) {
            memory.shutdown();
        } else if (store instanceof RedisCounterStore redis) {
            redis.close();
        }
    }
}
