package deskgate.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import deskgate.core.service.upload.UploadRejectedException;
import deskgate.system.filter.RequestIds;

/**
 * Global exception mappers converting exceptions to the gateway's JSON error envelope.
 *
 * <p>No stack trace or internal detail ever reaches the response body.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);

    @ServerExceptionMapper
    public Response mapUploadRejected(UploadRejectedException e, ContainerRequestContext ctx) {
        return GatewayError.uploadRejected(e.getReason(), e.getMessage(), RequestIds.of(ctx));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e, ContainerRequestContext ctx) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return GatewayError.badRequest(GatewayError.VALIDATION_ERROR, e.getMessage(), RequestIds.of(ctx));
    }

    @ServerExceptionMapper
    public Response mapWebApplicationException(WebApplicationException e) {
        return e.getResponse();
    }

    @ServerExceptionMapper
    public Response mapUnexpected(Exception e, ContainerRequestContext ctx) {
        final var requestId = RequestIds.of(ctx);
        LOG.errorv(e, "Unhandled error for request {0}", requestId);
        return GatewayError.internalError(requestId);
    }
}
