package deskgate.system.filter;

import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.container.ContainerRequestContext;

import io.vertx.core.http.HttpServerRequest;

import deskgate.core.model.admission.RequestDescriptor;
import deskgate.core.model.admission.RouteClass;

/**
 * Builds {@link RequestDescriptor}s from JAX-RS request contexts.
 */
@ApplicationScoped
public class RequestDescriptors {

    private final ClientIpResolver ipResolver;

    @Inject
    public RequestDescriptors(ClientIpResolver ipResolver) {
        this.ipResolver = ipResolver;
    }

    public RequestDescriptor describe(
            ContainerRequestContext ctx, HttpServerRequest request, RouteClass routeClass, Map<String, String> body) {
        return new RequestDescriptor(
                ctx.getMethod(),
                ctx.getUriInfo().getPath(),
                routeClass,
                ipResolver.resolve(ctx, request),
                callerIdentity(ctx),
                body);
    }

    /**
     * The authenticated caller, as established by the security layer in front of us.
     */
    static Optional<String> callerIdentity(ContainerRequestContext ctx) {
        final var security = ctx.getSecurityContext();
        if (security == null || security.getUserPrincipal() == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(security.getUserPrincipal().getName()).filter(name -> !name.isBlank());
    }
}
