package deskgate.adapter.in.problem;

import java.time.Instant;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import deskgate.core.model.admission.AdmissionDecision;
import deskgate.core.model.upload.RejectionReason;

/**
 * Factory for the gateway's error responses.
 *
 * <p>Bodies carry a reason code and a message only: no stack traces, no store details.
 */
public final class GatewayError {

    public static final String RATE_LIMIT_EXCEEDED = "RATE_LIMIT_EXCEEDED";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    public static final String HEADER_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    public static final String HEADER_RESET = "X-RateLimit-Reset";
    public static final String HEADER_RETRY_AFTER = "Retry-After";

    private GatewayError() {}

    /**
     * 429 for a rejected admission, with rate limit and retry headers.
     *
     * @param decision the rejection
     * @return the response
     */
    public static Response tooManyRequests(AdmissionDecision decision) {
        final var body = new ErrorEnvelope.ErrorBody(
                RATE_LIMIT_EXCEEDED,
                "Too many requests. Retry after %d seconds.".formatted(decision.retryAfterSeconds()),
                decision.limit(),
                decision.windowMs(),
                decision.retryAfterMs(),
                null,
                null);
        final var builder = Response.status(Response.Status.TOO_MANY_REQUESTS)
                .type(MediaType.APPLICATION_JSON_TYPE)
                .header(HEADER_RETRY_AFTER, decision.retryAfterSeconds())
                .header(HEADER_LIMIT, decision.limit())
                .header(HEADER_REMAINING, 0)
                .entity(new ErrorEnvelope(body));
        if (decision.resetAt() != null) {
            builder.header(HEADER_RESET, decision.resetAt().toString());
        }
        return builder.build();
    }

    /**
     * 400 for a refused upload.
     *
     * @param reason the rejection reason
     * @param message the message
     * @param requestId the request correlation id
     * @return the response
     */
    public static Response uploadRejected(RejectionReason reason, String message, String requestId) {
        return badRequest(reason.code(), message, requestId);
    }

    /**
     * 400 with a reason code.
     *
     * @param code the reason code
     * @param message the message
     * @param requestId the request correlation id
     * @return the response
     */
    public static Response badRequest(String code, String message, String requestId) {
        return error(Response.Status.BAD_REQUEST, code, message, requestId);
    }

    /**
     * 500 without any detail of the cause.
     *
     * @param requestId the request correlation id
     * @return the response
     */
    public static Response internalError(String requestId) {
        return error(Response.Status.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, "Internal server error", requestId);
    }

    private static Response error(Response.Status status, String code, String message, String requestId) {
        final var body = new ErrorEnvelope.ErrorBody(
                code, message, null, null, null, Instant.now().toString(), requestId != null ? requestId : "unknown");
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON_TYPE)
                .entity(new ErrorEnvelope(body))
                .build();
    }
}
