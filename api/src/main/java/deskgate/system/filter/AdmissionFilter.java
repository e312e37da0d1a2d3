package deskgate.system.filter;

import java.util.Map;

import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;

import deskgate.adapter.in.problem.GatewayError;
import deskgate.core.model.admission.AdmissionDecision;
import deskgate.core.model.admission.RouteClass;
import deskgate.core.service.gateway.RequestGateway;

/**
 * Admission control for every classified route except authentication attempts.
 *
 * <p>Runs before route matching and before the body is read, so rejected requests cost
 * neither authentication nor upload parsing. Authentication attempts need the submitted
 * identifier and are admitted by {@link CredentialAdmissionFilter} instead.
 */
public class AdmissionFilter {

    static final String DECISION_PROPERTY = "deskgate.admission.decision";
    static final String ROUTE_CLASS_PROPERTY = "deskgate.admission.route-class";

    private final RequestGateway gateway;
    private final RequestDescriptors descriptors;

    @Inject
    public AdmissionFilter(RequestGateway gateway, RequestDescriptors descriptors) {
        this.gateway = gateway;
        this.descriptors = descriptors;
    }

    @ServerRequestFilter(preMatching = true, priority = Priorities.AUTHENTICATION - 100)
    public Uni<Response> filter(ContainerRequestContext requestContext, HttpServerRequest request) {
        RequestIds.of(requestContext);
        final var routeClass = gateway.classify(
                        requestContext.getMethod(), requestContext.getUriInfo().getPath())
                .orElse(null);
        if (routeClass == null || routeClass == RouteClass.AUTHENTICATION) {
            return Uni.createFrom().nullItem();
        }

        final var descriptor = descriptors.describe(requestContext, request, routeClass, Map.of());
        return gateway.admit(descriptor).map(decision -> apply(requestContext, routeClass, decision));
    }

    /**
     * Remember the decision for the response filter and abort when rejected.
     *
     * @return the 429 response, or null to continue
     */
    static Response apply(ContainerRequestContext ctx, RouteClass routeClass, AdmissionDecision decision) {
        ctx.setProperty(ROUTE_CLASS_PROPERTY, routeClass);
        ctx.setProperty(DECISION_PROPERTY, decision);
        return decision.admitted() ? null : GatewayError.tooManyRequests(decision);
    }
}
