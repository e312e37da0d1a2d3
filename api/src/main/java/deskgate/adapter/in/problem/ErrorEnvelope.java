package deskgate.adapter.in.problem;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON error body: {@code {"error": {"code": ..., "message": ..., ...}}}.
 *
 * @param error the error details
 */
public record ErrorEnvelope(ErrorBody error) {

    /**
     * Error details. Fields that do not apply to an error are omitted.
     *
     * @param code machine-readable reason code
     * @param message human-readable message
     * @param limit requests allowed per window (rate limit errors)
     * @param windowMs window length in milliseconds (rate limit errors)
     * @param retryAfter milliseconds until the window resets (rate limit errors)
     * @param timestamp ISO-8601 time of the error
     * @param requestId correlation id of the request
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorBody(
            String code,
            String message,
            Long limit,
            Long windowMs,
            Long retryAfter,
            String timestamp,
            String requestId) {}
}
