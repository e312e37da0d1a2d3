package deskgate.system.filter;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;

import deskgate.core.config.AdmissionConfig;
import deskgate.core.model.admission.RouteClass;
import deskgate.core.service.gateway.RequestGateway;

/**
 * Admission control for authentication attempts.
 *
 * <p>Attempts are limited per IP and submitted identifier, so the body has to be read
 * first. The identifier is taken from a JSON or form-encoded body and the entity stream
 * is restored for the resource.
 */
public class CredentialAdmissionFilter {

    private static final Logger LOG = Logger.getLogger(CredentialAdmissionFilter.class);

    private final RequestGateway gateway;
    private final RequestDescriptors descriptors;
    private final ObjectMapper objectMapper;
    private final String identifierField;

    @Inject
    public CredentialAdmissionFilter(
            RequestGateway gateway, RequestDescriptors descriptors, ObjectMapper objectMapper, AdmissionConfig config) {
        this.gateway = gateway;
        this.descriptors = descriptors;
        this.objectMapper = objectMapper;
        this.identifierField = config.identifierField();
    }

    @ServerRequestFilter(readBody = true, priority = Priorities.AUTHENTICATION - 100)
    public Uni<Response> filter(ContainerRequestContext requestContext, HttpServerRequest request) {
        final var routeClass = gateway.classify(
                        requestContext.getMethod(), requestContext.getUriInfo().getPath())
                .orElse(null);
        if (routeClass != RouteClass.AUTHENTICATION) {
            return Uni.createFrom().nullItem();
        }

        final var identifier = readIdentifier(requestContext);
        final Map<String, String> body = identifier.map(v -> Map.of(identifierField, v)).orElse(Map.of());
        final var descriptor = descriptors.describe(requestContext, request, routeClass, body);
        return gateway.admit(descriptor).map(decision -> AdmissionFilter.apply(requestContext, routeClass, decision));
    }

    private Optional<String> readIdentifier(ContainerRequestContext ctx) {
        if (!ctx.hasEntity()) {
            return Optional.empty();
        }
        final byte[] bytes;
        try (var in = ctx.getEntityStream()) {
            bytes = in.readAllBytes();
        } catch (IOException e) {
            LOG.debugv("Could not read credential body: {0}", e.getMessage());
            return Optional.empty();
        }
        ctx.setEntityStream(new ByteArrayInputStream(bytes));

        final var mediaType = ctx.getMediaType();
        if (mediaType != null && mediaType.isCompatible(MediaType.APPLICATION_FORM_URLENCODED_TYPE)) {
            return formField(new String(bytes, StandardCharsets.UTF_8), identifierField);
        }
        return jsonField(bytes, identifierField);
    }

    Optional<String> jsonField(byte[] bytes, String field) {
        try {
            final var node = objectMapper.readTree(bytes);
            if (node == null || !node.isObject() || !node.path(field).isTextual()) {
                return Optional.empty();
            }
            return Optional.of(node.get(field).asText());
        } catch (IOException e) {
            LOG.debugv("Credential body is not JSON: {0}", e.getMessage());
            return Optional.empty();
        }
    }

    static Optional<String> formField(String body, String field) {
        for (final var pair : body.split("&")) {
            final var separator = pair.indexOf('=');
            if (separator <= 0) {
                continue;
            }
            try {
                final var name = URLDecoder.decode(pair.substring(0, separator), StandardCharsets.UTF_8);
                if (name.equals(field)) {
                    return Optional.of(URLDecoder.decode(pair.substring(separator + 1), StandardCharsets.UTF_8));
                }
            } catch (IllegalArgumentException e) {
                LOG.debugv("Skipping malformed form pair in credential body: {0}", e.getMessage());
            }
        }
        return Optional.empty();
    }
}
