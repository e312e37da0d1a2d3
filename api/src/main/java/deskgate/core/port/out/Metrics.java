package deskgate.core.port.out;

import deskgate.core.model.admission.AdmissionDecision;
import deskgate.core.model.admission.RouteClass;
import deskgate.core.model.upload.ValidationVerdict;

/**
 * Port interface for recording gateway metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record an admission check.
     *
     * @param routeClass the route class checked
     * @param decision the decision reached
     */
    void recordAdmission(RouteClass routeClass, AdmissionDecision decision);

    /**
     * Record a counter store failure or timeout.
     *
     * @param operation the store operation (get, increment, decrement)
     */
    void recordStoreFailure(String operation);

    /**
     * Record a slot released by the post-request hook.
     *
     * @param routeClass the route class
     */
    void recordRelease(RouteClass routeClass);

    /**
     * Record an upload verdict.
     *
     * @param verdict the verdict
     */
    void recordUploadVerdict(ValidationVerdict verdict);

    /**
     * A metrics implementation that records nothing.
     *
     * @return the no-op instance
     */
    static Metrics noop() {
        return NoopMetrics.INSTANCE;
    }

    /**
     * No-op implementation, used in unit tests and when no registry is present.
     */
    final class NoopMetrics implements Metrics {

        private static final NoopMetrics INSTANCE = new NoopMetrics();

        private NoopMetrics() {}

        @Override
        public boolean isEnabled() {
            return false;
        }

        @Override
        public void recordAdmission(RouteClass routeClass, AdmissionDecision decision) {}

        @Override
        public void recordStoreFailure(String operation) {}

        @Override
        public void recordRelease(RouteClass routeClass) {}

        @Override
        public void recordUploadVerdict(ValidationVerdict verdict) {}
    }
}
