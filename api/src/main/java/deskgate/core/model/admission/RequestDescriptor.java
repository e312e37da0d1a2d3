package deskgate.core.model.admission;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * What the admission layer knows about an incoming request.
 *
 * <p>Built by the HTTP edge from the routing layer's view of the request. Only the
 * body fields a key generator may need are carried, never the full body.
 *
 * @param method the HTTP method
 * @param path the request path
 * @param routeClass the route class the path was classified into
 * @param clientIp the caller IP address, or {@code null} when unknown
 * @param callerIdentity the authenticated caller identity, if any
 * @param bodyFields body fields extracted for key generation
 */
public record RequestDescriptor(
        String method,
        String path,
        RouteClass routeClass,
        String clientIp,
        Optional<String> callerIdentity,
        Map<String, String> bodyFields) {

    public RequestDescriptor {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(routeClass, "routeClass must not be null");
        callerIdentity = Objects.requireNonNullElse(callerIdentity, Optional.empty());
        bodyFields = bodyFields == null ? Map.of() : Map.copyOf(bodyFields);
    }

    /**
     * Look up a body field, treating blank values as absent.
     *
     * @param name the field name
     * @return the field value, if present and not blank
     */
    public Optional<String> bodyField(String name) {
        return Optional.ofNullable(bodyFields.get(name)).filter(v -> !v.isBlank());
    }

    /**
     * Return the client IP, treating blank values as absent.
     *
     * @return the client IP, if known
     */
    public Optional<String> ip() {
        return Optional.ofNullable(clientIp).filter(v -> !v.isBlank());
    }
}
