package deskgate.core.model.admission;

/**
 * Derives the limiter bucket for a request.
 *
 * <p>Implementations must be deterministic and must include something caller-specific
 * (IP or identity), never only the route.
 */
@FunctionalInterface
public interface KeyGenerator {

    RateLimitKey generate(RequestDescriptor request);
}
