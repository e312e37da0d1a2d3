package deskgate.system.filter;

import java.util.Locale;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.container.ContainerRequestContext;

import io.vertx.core.http.HttpServerRequest;

import deskgate.core.config.AdmissionConfig;

/**
 * Resolves the caller IP of a request.
 *
 * <p>When forwarding headers are trusted, checks in the following order:
 * <ol>
 *   <li>RFC 7239 {@code Forwarded} header's {@code for} parameter (first entry)</li>
 *   <li>Legacy {@code X-Forwarded-For} header (first IP in chain)</li>
 * </ol>
 * and otherwise, or when neither is present, uses the socket's remote address.
 */
@ApplicationScoped
public class ClientIpResolver {

    private final boolean trustForwardedHeaders;

    @Inject
    public ClientIpResolver(AdmissionConfig config) {
        this(config.trustForwardedHeaders());
    }

    public ClientIpResolver(boolean trustForwardedHeaders) {
        this.trustForwardedHeaders = trustForwardedHeaders;
    }

    /**
     * Resolve the caller IP.
     *
     * @param ctx the request context
     * @param request the underlying HTTP request, may be null
     * @return the IP, or null when unknown
     */
    public String resolve(ContainerRequestContext ctx, HttpServerRequest request) {
        return resolve(ctx::getHeaderString, request);
    }

    /**
     * Resolve the caller IP from a header lookup.
     *
     * @param headers returns a header value by name, or null
     * @param request the underlying HTTP request, may be null
     * @return the IP, or null when unknown
     */
    public String resolve(UnaryOperator<String> headers, HttpServerRequest request) {
        if (trustForwardedHeaders) {
            final var forwarded = headers.apply("Forwarded");
            if (forwarded != null) {
                final var ip = parseForwardedFor(forwarded);
                if (ip != null && !ip.isBlank()) {
                    return ip;
                }
            }
            final var xForwardedFor = headers.apply("X-Forwarded-For");
            if (xForwardedFor != null && !xForwardedFor.isBlank()) {
                return xForwardedFor.split(",")[0].trim();
            }
        }
        if (request != null && request.remoteAddress() != null) {
            return request.remoteAddress().hostAddress();
        }
        return null;
    }

    /**
     * Parse the client IP from an RFC 7239 Forwarded header.
     *
     * @param forwarded the Forwarded header value
     * @return the client IP, or null if not found
     */
    static String parseForwardedFor(String forwarded) {
        // First entry is the one closest to the client
        final var firstEntry = forwarded.split(",")[0].trim();

        for (final var part : firstEntry.split(";")) {
            final var trimmed = part.trim();
            if (!trimmed.toLowerCase(Locale.ROOT).startsWith("for=")) {
                continue;
            }
            var value = trimmed.substring(4);
            if (value.startsWith("\"") && value.endsWith("\"") && value.length() >= 2) {
                value = value.substring(1, value.length() - 1);
            }
            // IPv6: [addr]:port
            if (value.startsWith("[")) {
                final var bracketEnd = value.indexOf(']');
                return bracketEnd > 0 ? value.substring(1, bracketEnd) : null;
            }
            // IPv4 with port has exactly one colon
            final var colonCount = value.length() - value.replace(":", "").length();
            if (colonCount == 1) {
                value = value.substring(0, value.indexOf(':'));
            }
            return value;
        }
        return null;
    }
}
