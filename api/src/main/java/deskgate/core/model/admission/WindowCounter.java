package deskgate.core.model.admission;

/**
 * The counter of one key within one fixed window.
 *
 * <p>{@code windowIndex = floor(nowMs / windowMs)}; the counter lives in the shared
 * store under {@link #counterId()} and expires after {@code ttlSeconds}.
 *
 * @param key the namespaced key string
 * @param windowIndex the fixed-window index
 * @param ttlSeconds the expiry applied on every increment
 */
public record WindowCounter(String key, long windowIndex, long ttlSeconds) {

    /**
     * Locate the counter that covers {@code nowMs} for the given key and policy.
     *
     * @param key the namespaced key string
     * @param policy the policy supplying window length and TTL
     * @param nowMs current epoch milliseconds
     * @return the counter
     */
    public static WindowCounter at(String key, RateLimitPolicy policy, long nowMs) {
        return new WindowCounter(key, Math.floorDiv(nowMs, policy.windowMs()), policy.ttlSeconds());
    }

    /**
     * The store identifier: {@code key + ":" + windowIndex}.
     *
     * @return the counter id
     */
    public String counterId() {
        return key + ":" + windowIndex;
    }
}
