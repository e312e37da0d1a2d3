package deskgate.system.filter;

import java.util.UUID;

import jakarta.ws.rs.container.ContainerRequestContext;

/**
 * Request correlation ids: taken from {@code X-Request-Id} when the caller sends one,
 * otherwise generated, and kept on the request context for the rest of the request.
 */
public final class RequestIds {

    public static final String HEADER = "X-Request-Id";
    static final String PROPERTY = "deskgate.request-id";
    private static final int MAX_LENGTH = 128;

    private RequestIds() {}

    /**
     * Return the correlation id of a request, assigning one on first use.
     *
     * @param ctx the request context
     * @return the request id
     */
    public static String of(ContainerRequestContext ctx) {
        final var existing = ctx.getProperty(PROPERTY);
        if (existing instanceof String id) {
            return id;
        }
        final var header = ctx.getHeaderString(HEADER);
        final var id = header != null && !header.isBlank() && header.length() <= MAX_LENGTH
                ? header.trim()
                : UUID.randomUUID().toString();
        ctx.setProperty(PROPERTY, id);
        return id;
    }
}
