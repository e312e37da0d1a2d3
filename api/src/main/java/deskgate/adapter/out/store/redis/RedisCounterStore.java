package deskgate.adapter.out.store.redis;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.redis.client.Command;
import io.vertx.mutiny.redis.client.Redis;
import io.vertx.mutiny.redis.client.Request;
import io.vertx.mutiny.redis.client.Response;
import org.jboss.logging.Logger;

import deskgate.core.model.admission.StoreHealth;
import deskgate.core.port.out.CounterStore;
import deskgate.core.port.out.CounterStoreException;

/**
 * Redis-backed counter store shared by every gateway instance.
 *
 * <p>Increment and expiry are one Lua {@code EVAL}, so a counter is never left without a
 * TTL even if the caller goes away mid-request. Every command is bounded by the client
 * timeout. Command outcomes drive the store's {@link StoreHealth}: a failure marks it down
 * and a {@code PING} is sent every probe interval until Redis answers again.
 */
public final class RedisCounterStore implements CounterStore {

    private static final Logger LOG = Logger.getLogger(RedisCounterStore.class);

    /**
     * Increment a counter and (re)apply its TTL atomically.
     *
     * <ol>
     *   <li>KEYS[1] - the counter id</li>
     *   <li>ARGV[1] - TTL in seconds</li>
     * </ol>
     *
     * <p>Returns the value after incrementing.
     */
    static final String INCREMENT_SCRIPT =
            """
            local count = redis.call('INCR', KEYS[1])
            redis.call('EXPIRE', KEYS[1], tonumber(ARGV[1]))
            return count
            """;

    /**
     * Decrement a counter only if it still exists, so an expired counter is never
     * recreated without a TTL. Never goes below zero.
     *
     * <p>Returns the value after decrementing, or 0 when the counter is gone.
     */
    static final String DECREMENT_SCRIPT =
            """
            if redis.call('EXISTS', KEYS[1]) == 0 then
                return 0
            end
            local count = redis.call('DECR', KEYS[1])
            if count < 0 then
                redis.call('INCR', KEYS[1])
                return 0
            end
            return count
            """;

    private final Redis redis;
    private final Vertx vertx;
    private final Duration timeout;
    private final StoreHealth health;
    private final AtomicBoolean probing = new AtomicBoolean(false);
    private final long probeTimerId;

    /**
     * Creates the store and starts probing until Redis first answers.
     *
     * @param redis the Redis client
     * @param vertx the Vert.x instance for the probe timer
     * @param timeout client-side timeout per command
     * @param probeInterval period of the PING probe while the store is down
     */
    public RedisCounterStore(Redis redis, Vertx vertx, Duration timeout, Duration probeInterval) {
        this.redis = redis;
        this.vertx = vertx;
        this.timeout = timeout;
        this.health = new StoreHealth("redis", StoreHealth.State.DOWN);
        this.probeTimerId = vertx.setPeriodic(probeInterval.toMillis(), id -> probe());
        probe();
    }

    @Override
    public Uni<Long> get(String counterId) {
        return execute("get", Request.cmd(Command.GET).arg(counterId))
                .map(response -> response == null ? 0L : response.toLong());
    }

    @Override
    public Uni<Long> incrementWithExpiry(String counterId, long ttlSeconds) {
        final var request = Request.cmd(Command.EVAL)
                .arg(INCREMENT_SCRIPT)
                .arg(1)
                .arg(counterId)
                .arg(ttlSeconds);
        return execute("increment", request).map(RedisCounterStore::toLong);
    }

    @Override
    public Uni<Long> decrement(String counterId) {
        final var request = Request.cmd(Command.EVAL).arg(DECREMENT_SCRIPT).arg(1).arg(counterId);
        return execute("decrement", request).map(RedisCounterStore::toLong);
    }

    @Override
    public StoreHealth health() {
        return health;
    }

    @Override
    public String name() {
        return "redis";
    }

    /**
     * Stops the probe timer and closes the client.
     */
    public void close() {
        vertx.cancelTimer(probeTimerId);
        redis.close();
    }

    /**
     * Sends a PING when the store is not up. Only one probe is in flight at a time.
     */
    void probe() {
        if (health.isAvailable() || !probing.compareAndSet(false, true)) {
            return;
        }
        execute("ping", Request.cmd(Command.PING))
                .subscribe()
                .with(ignored -> probing.set(false), error -> {
                    LOG.debugv("Redis probe failed: {0}", error.getMessage());
                    probing.set(false);
                });
    }

    private Uni<Response> execute(String operation, Request request) {
        return redis.send(request)
                .ifNoItem()
                .after(timeout)
                .failWith(() -> new CounterStoreException(
                        operation, "Redis " + operation + " timed out after " + timeout.toMillis() + "ms"))
                .onItem()
                .invoke(ignored -> health.markUp())
                .onFailure()
                .transform(error -> {
                    health.markDown(error);
                    return error instanceof CounterStoreException
                            ? error
                            : new CounterStoreException(operation, "Redis " + operation + " failed", error);
                });
    }

    private static Long toLong(Response response) {
        if (response == null) {
            throw new CounterStoreException("eval", "Null response from Redis");
        }
        return response.toLong();
    }
}
