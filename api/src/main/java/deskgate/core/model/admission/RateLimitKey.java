package deskgate.core.model.admission;

import java.util.List;
import java.util.Objects;

/**
 * Identifies one logical limiter bucket.
 *
 * <p>Key format: {@code {routeClass}:{part}[:{part}...]}, e.g.
 * {@code authentication:10.0.0.1:jane@example.com}. The route class is always the
 * first segment, so two route classes never share a bucket even for the same caller.
 * Each part has {@code %} and {@code :} percent-encoded, so an IPv6 address or an
 * identifier containing {@code :} cannot shift into a neighbouring segment.
 *
 * @param routeClass the route class that owns the bucket
 * @param parts the caller-derived parts (IP, identity, request attribute), in order
 */
public record RateLimitKey(RouteClass routeClass, List<String> parts) {

    public RateLimitKey {
        Objects.requireNonNull(routeClass, "routeClass must not be null");
        Objects.requireNonNull(parts, "parts must not be null");
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("a rate limit key needs at least one caller-derived part");
        }
        parts = List.copyOf(parts);
    }

    /**
     * Create a key from a route class and its caller-derived parts.
     *
     * @param routeClass the route class
     * @param parts the parts
     * @return the key
     */
    public static RateLimitKey of(RouteClass routeClass, String... parts) {
        return new RateLimitKey(routeClass, List.of(parts));
    }

    /**
     * Render the key as the string stored in the shared counter store.
     *
     * @return the key string, without any namespace prefix
     */
    public String value() {
        final var joined = new StringBuilder(routeClass.configName());
        for (final var part : parts) {
            joined.append(':').append(encode(part));
        }
        return joined.toString();
    }

    static String encode(String part) {
        if (part.indexOf('%') < 0 && part.indexOf(':') < 0) {
            return part;
        }
        return part.replace("%", "%25").replace(":", "%3A");
    }

    @Override
    public String toString() {
        return value();
    }
}
