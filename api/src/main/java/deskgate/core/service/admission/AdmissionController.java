package deskgate.core.service.admission;

import java.time.Clock;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import deskgate.core.config.AdmissionConfig;
import deskgate.core.model.admission.AdmissionDecision;
import deskgate.core.model.admission.RateLimitPolicy;
import deskgate.core.model.admission.RequestDescriptor;
import deskgate.core.model.admission.WindowCounter;
import deskgate.core.port.out.CounterStore;
import deskgate.core.port.out.CounterStoreException;
import deskgate.core.port.out.Metrics;

/**
 * Fixed-window admission control over the shared counter store.
 *
 * <p>For each request the current window counter is read; a full bucket rejects without
 * counting, otherwise the counter is incremented together with its expiry. The read and
 * the increment are separate commands, so requests racing at the limit can overshoot it
 * by at most the number of requests in flight.
 *
 * <p>Any store failure, timeout or unavailability admits the request. An outage of the
 * shared store must not deny service to every caller.
 */
@ApplicationScoped
public class AdmissionController {

    private static final Logger LOG = Logger.getLogger(AdmissionController.class);

    private final CounterStore store;
    private final Metrics metrics;
    private final Clock clock;
    private final String keyPrefix;

    @Inject
    public AdmissionController(CounterStore store, Metrics metrics, Clock clock, AdmissionConfig config) {
        this(store, metrics, clock, config.keyPrefix());
    }

    public AdmissionController(CounterStore store, Metrics metrics, Clock clock, String keyPrefix) {
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
        this.keyPrefix = keyPrefix;
    }

    /**
     * Decide whether a request may proceed under a policy.
     *
     * <p>The returned {@link Uni} never fails.
     *
     * @param request the request descriptor
     * @param policy the policy of the request's route class
     * @return the decision
     */
    public Uni<AdmissionDecision> admit(RequestDescriptor request, RateLimitPolicy policy) {
        final String key;
        try {
            key = keyPrefix + policy.keyGenerator().generate(request).value();
        } catch (RuntimeException e) {
            LOG.warnv("Could not derive rate limit key for {0} {1}: {2}", request.method(), request.path(), e);
            return Uni.createFrom().item(record(policy, AdmissionDecision.failOpen(policy)));
        }

        if (!store.health().isAvailable()) {
            LOG.debugv("Counter store {0} is {1}, admitting without counting", store.name(), store.health().state());
            return Uni.createFrom().item(record(policy, AdmissionDecision.failOpen(policy)));
        }

        final var nowMs = clock.millis();
        final var counter = WindowCounter.at(key, policy, nowMs);
        final var counterId = counter.counterId();
        final var resetAt = Instant.ofEpochMilli((counter.windowIndex() + 1) * policy.windowMs());
        final var retryAfterMs = policy.windowMs() - Math.floorMod(nowMs, policy.windowMs());

        return Uni.createFrom()
                .deferred(() -> store.get(counterId))
                .map(count -> requireReply(count, "get"))
                .flatMap(count -> {
                    if (count >= policy.maxRequests()) {
                        LOG.debugv("Rate limit exceeded for {0} ({1}/{2})", counterId, count, policy.maxRequests());
                        return Uni.createFrom().item(AdmissionDecision.rejected(policy, retryAfterMs, resetAt));
                    }
                    return store.incrementWithExpiry(counterId, counter.ttlSeconds())
                            .map(after -> requireReply(after, "increment"))
                            .map(ignored -> AdmissionDecision.admitted(
                                    policy, policy.maxRequests() - count - 1, resetAt, counterId));
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Counter store {0} failed for {1}, admitting request: {2}",
                            store.name(), counterId, error.getMessage());
                    metrics.recordStoreFailure(operationOf(error));
                    return AdmissionDecision.failOpen(policy);
                })
                .map(decision -> record(policy, decision));
    }

    /**
     * Post-request hook: give the slot back when the policy skips requests that ended with
     * this status.
     *
     * <p>Best effort. A failed decrement is logged and not retried; the returned
     * {@link Uni} never fails.
     *
     * @param policy the policy the decision was made under
     * @param decision the admission decision of the request
     * @param status the final response status
     * @return completes once the decrement has been attempted
     */
    public Uni<Void> complete(RateLimitPolicy policy, AdmissionDecision decision, int status) {
        if (decision.counterId().isEmpty() || !policy.releasesSlotFor(status)) {
            return Uni.createFrom().voidItem();
        }
        final var counterId = decision.counterId().get();
        return Uni.createFrom()
                .deferred(() -> store.decrement(counterId))
                .invoke(ignored -> metrics.recordRelease(policy.routeClass()))
                .replaceWithVoid()
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Could not release rate limit slot {0}: {1}", counterId, error.getMessage());
                    metrics.recordStoreFailure("decrement");
                    return null;
                });
    }

    private AdmissionDecision record(RateLimitPolicy policy, AdmissionDecision decision) {
        metrics.recordAdmission(policy.routeClass(), decision);
        return decision;
    }

    private static long requireReply(Long reply, String operation) {
        if (reply == null) {
            throw new CounterStoreException(operation, "Empty reply from counter store");
        }
        return reply;
    }

    private static String operationOf(Throwable error) {
        return error instanceof CounterStoreException storeError ? storeError.getOperation() : "unknown";
    }
}
