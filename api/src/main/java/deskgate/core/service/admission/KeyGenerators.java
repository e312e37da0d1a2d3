package deskgate.core.service.admission;

import deskgate.core.model.admission.KeyGenerator;
import deskgate.core.model.admission.RateLimitKey;

/**
 * The key generators used by the reference policies.
 *
 * <p>Every generator puts something caller-specific into the key. Missing values are
 * replaced by fixed placeholders so a request without an IP or identity still lands in
 * a deterministic bucket.
 */
public final class KeyGenerators {

    static final String UNKNOWN = "unknown";
    static final String ANONYMOUS = "anonymous";

    private KeyGenerators() {}

    /**
     * One bucket per client IP.
     */
    public static KeyGenerator ip() {
        return request -> RateLimitKey.of(request.routeClass(), request.ip().orElse(UNKNOWN));
    }

    /**
     * One bucket per client IP and submitted identifier, e.g. the email of a login attempt.
     *
     * @param field the body field holding the identifier
     */
    public static KeyGenerator ipAndIdentifier(String field) {
        return request -> RateLimitKey.of(
                request.routeClass(),
                request.ip().orElse(UNKNOWN),
                request.bodyField(field).map(String::trim).orElse(UNKNOWN));
    }

    /**
     * One bucket per client IP and authenticated caller.
     */
    public static KeyGenerator ipAndCaller() {
        return request -> RateLimitKey.of(
                request.routeClass(), request.ip().orElse(UNKNOWN), request.callerIdentity().orElse(ANONYMOUS));
    }

    /**
     * One bucket per authenticated caller, or per IP for anonymous requests.
     *
     * <p>The key records which of the two it used, so a caller id that happens to look
     * like an IP never shares a bucket with that IP.
     */
    public static KeyGenerator callerOrIp() {
        return request -> request.callerIdentity()
                .map(caller -> RateLimitKey.of(request.routeClass(), "user", caller))
                .orElseGet(() -> RateLimitKey.of(request.routeClass(), "ip", request.ip().orElse(UNKNOWN)));
    }
}
