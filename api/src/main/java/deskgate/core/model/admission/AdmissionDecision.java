package deskgate.core.model.admission;

import java.time.Instant;
import java.util.Optional;

/**
 * Result of an admission check.
 *
 * @param outcome how the decision was reached
 * @param limit the policy's requests per window (0 when no policy applied)
 * @param remaining requests left in the current window after this one
 * @param windowMs the policy window in milliseconds
 * @param retryAfterMs milliseconds until the window rolls over (only meaningful when rejected)
 * @param resetAt when the current window ends
 * @param counterId the store counter that was incremented, present only for counted admissions
 */
public record AdmissionDecision(
        Outcome outcome,
        long limit,
        long remaining,
        long windowMs,
        long retryAfterMs,
        Instant resetAt,
        Optional<String> counterId) {

    /**
     * How an admission decision was reached.
     */
    public enum Outcome {
        /** Counted against the bucket and admitted. */
        ADMITTED,
        /** Bucket full; nothing was counted. */
        REJECTED,
        /** Shared store unavailable or erroring; admitted without counting. */
        FAIL_OPEN,
        /** No policy applies, or admission control is disabled. */
        UNLIMITED
    }

    public AdmissionDecision {
        counterId = counterId == null ? Optional.empty() : counterId;
    }

    public static AdmissionDecision admitted(
            RateLimitPolicy policy, long remaining, Instant resetAt, String counterId) {
        return new AdmissionDecision(
                Outcome.ADMITTED,
                policy.maxRequests(),
                Math.max(0, remaining),
                policy.windowMs(),
                0,
                resetAt,
                Optional.of(counterId));
    }

    public static AdmissionDecision rejected(RateLimitPolicy policy, long retryAfterMs, Instant resetAt) {
        return new AdmissionDecision(
                Outcome.REJECTED, policy.maxRequests(), 0, policy.windowMs(), retryAfterMs, resetAt, Optional.empty());
    }

    public static AdmissionDecision failOpen(RateLimitPolicy policy) {
        return new AdmissionDecision(
                Outcome.FAIL_OPEN,
                policy.maxRequests(),
                policy.maxRequests(),
                policy.windowMs(),
                0,
                null,
                Optional.empty());
    }

    public static AdmissionDecision unlimited() {
        return new AdmissionDecision(Outcome.UNLIMITED, 0, Long.MAX_VALUE, 0, 0, null, Optional.empty());
    }

    public boolean admitted() {
        return outcome != Outcome.REJECTED;
    }

    /**
     * Whether rate-limit headers describe a real bucket for this decision.
     *
     * @return true for counted admissions and rejections
     */
    public boolean counted() {
        return outcome == Outcome.ADMITTED || outcome == Outcome.REJECTED;
    }

    /**
     * Retry hint rounded up to whole seconds, for the {@code Retry-After} header.
     *
     * @return seconds, at least 1 for a rejection
     */
    public long retryAfterSeconds() {
        return Math.max(1, (retryAfterMs + 999) / 1000);
    }
}
