package deskgate.system.filter;

import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.HttpHeaders;

import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;

import deskgate.core.model.admission.RouteClass;
import deskgate.core.model.upload.ValidationVerdict;
import deskgate.core.service.gateway.RequestGateway;
import deskgate.core.service.upload.FormLimits;
import deskgate.core.service.upload.UploadRejectedException;

/**
 * Refuses upload requests whose declared {@code Content-Length} no valid upload could reach,
 * before the multipart body is read.
 *
 * <p>Runs after admission, so an oversized attempt still counts against the caller. Bodies
 * beyond {@code quarkus.http.limits.max-body-size} never get this far.
 */
public class UploadSizeFilter {

    private static final Logger LOG = Logger.getLogger(UploadSizeFilter.class);

    private final RequestGateway gateway;
    private final FormLimits formLimits;

    @Inject
    public UploadSizeFilter(RequestGateway gateway, FormLimits formLimits) {
        this.gateway = gateway;
        this.formLimits = formLimits;
    }

    @ServerRequestFilter(preMatching = true, priority = Priorities.AUTHENTICATION - 50)
    public void filter(ContainerRequestContext requestContext) {
        final var routeClass = gateway.classify(
                        requestContext.getMethod(), requestContext.getUriInfo().getPath())
                .orElse(null);
        if (routeClass != RouteClass.UPLOAD) {
            return;
        }

        final var contentLength = parseContentLength(requestContext.getHeaderString(HttpHeaders.CONTENT_LENGTH));
        if (formLimits.checkDeclaredLength(contentLength) instanceof ValidationVerdict.Rejected rejected) {
            LOG.warnv(
                    "Upload blocked before parsing: declared length {0} exceeds {1} (request {2})",
                    contentLength, formLimits.maxRequestBytes(), RequestIds.of(requestContext));
            throw new UploadRejectedException(rejected);
        }
    }

    static long parseContentLength(String header) {
        if (header == null || header.isBlank()) {
            return -1;
        }
        try {
            return Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
