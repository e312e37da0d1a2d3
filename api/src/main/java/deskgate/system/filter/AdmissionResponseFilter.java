package deskgate.system.filter;

import jakarta.inject.Inject;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;

import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerResponseFilter;

import deskgate.adapter.in.problem.GatewayError;
import deskgate.core.config.AdmissionConfig;
import deskgate.core.model.admission.AdmissionDecision;
import deskgate.core.model.admission.RouteClass;
import deskgate.core.service.gateway.RequestGateway;

/**
 * Adds rate limit headers to admitted responses and runs the post-request hook with the
 * final status. The hook is fire-and-forget and never delays the response.
 */
public class AdmissionResponseFilter {

    private static final Logger LOG = Logger.getLogger(AdmissionResponseFilter.class);

    private final RequestGateway gateway;
    private final boolean includeHeaders;

    @Inject
    public AdmissionResponseFilter(RequestGateway gateway, AdmissionConfig config) {
        this.gateway = gateway;
        this.includeHeaders = config.includeHeaders();
    }

    @ServerResponseFilter
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        if (!(requestContext.getProperty(AdmissionFilter.DECISION_PROPERTY) instanceof AdmissionDecision decision)
                || !(requestContext.getProperty(AdmissionFilter.ROUTE_CLASS_PROPERTY)
                        instanceof RouteClass routeClass)) {
            return;
        }

        if (includeHeaders && decision.outcome() == AdmissionDecision.Outcome.ADMITTED) {
            final var headers = responseContext.getHeaders();
            headers.putSingle(GatewayError.HEADER_LIMIT, decision.limit());
            headers.putSingle(GatewayError.HEADER_REMAINING, decision.remaining());
            headers.putSingle(GatewayError.HEADER_RESET, decision.resetAt().toString());
        }

        gateway.complete(routeClass, decision, responseContext.getStatus())
                .subscribe()
                .with(
                        ignored -> {},
                        error -> LOG.warnv("Post-request admission hook failed: {0}", error.getMessage()));
    }
}
