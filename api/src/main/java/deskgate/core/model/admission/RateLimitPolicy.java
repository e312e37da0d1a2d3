package deskgate.core.model.admission;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable limiter configuration for one route class.
 *
 * <p>Requests are counted in fixed windows of {@code windowMs}. Fixed windows allow a
 * caller to send up to twice {@code maxRequests} across a window boundary; that burst
 * is accepted in exchange for a single counter per window.
 *
 * @param routeClass the route class this policy protects
 * @param windowMs the window length in milliseconds
 * @param maxRequests requests admitted per key per window
 * @param keyGenerator derives the bucket key from a request
 * @param skipOnSuccess release the slot when the response status is below 400
 * @param skipOnFailure release the slot when the response status is 400 or above
 */
public record RateLimitPolicy(
        RouteClass routeClass,
        long windowMs,
        long maxRequests,
        KeyGenerator keyGenerator,
        boolean skipOnSuccess,
        boolean skipOnFailure) {

    public RateLimitPolicy {
        Objects.requireNonNull(routeClass, "routeClass must not be null");
        Objects.requireNonNull(keyGenerator, "keyGenerator must not be null");
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be positive");
        }
        if (maxRequests < 0) {
            throw new IllegalArgumentException("maxRequests must be non-negative");
        }
    }

    /**
     * Create a policy that counts every request.
     *
     * @param routeClass the route class
     * @param window the window length
     * @param maxRequests requests per window
     * @param keyGenerator the key generator
     * @return the policy
     */
    public static RateLimitPolicy of(
            RouteClass routeClass, Duration window, long maxRequests, KeyGenerator keyGenerator) {
        return new RateLimitPolicy(routeClass, window.toMillis(), maxRequests, keyGenerator, false, false);
    }

    /**
     * Return a copy that releases the slot of successful requests.
     *
     * @return the new policy
     */
    public RateLimitPolicy skippingSuccessful() {
        return new RateLimitPolicy(routeClass, windowMs, maxRequests, keyGenerator, true, skipOnFailure);
    }

    /**
     * Return a copy that releases the slot of failed requests.
     *
     * @return the new policy
     */
    public RateLimitPolicy skippingFailed() {
        return new RateLimitPolicy(routeClass, windowMs, maxRequests, keyGenerator, skipOnSuccess, true);
    }

    /**
     * Counter TTL: the window length rounded up to whole seconds.
     *
     * @return TTL in seconds, at least 1
     */
    public long ttlSeconds() {
        return Math.max(1, (windowMs + 999) / 1000);
    }

    /**
     * Whether a request that finished with the given status gives its slot back.
     *
     * @param status the final response status
     * @return true if the counter should be decremented
     */
    public boolean releasesSlotFor(int status) {
        return (skipOnSuccess && status < 400) || (skipOnFailure && status >= 400);
    }
}
