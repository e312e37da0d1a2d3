package deskgate.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import deskgate.core.config.TelemetryConfig;
import deskgate.core.model.admission.AdmissionDecision;
import deskgate.core.model.admission.RouteClass;
import deskgate.core.model.upload.ValidationVerdict;
import deskgate.core.port.out.Metrics;

/**
 * Records gateway metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code deskgate.admission.checks} - Admission decisions by route class and outcome</li>
 *   <li>{@code deskgate.admission.store.failures} - Counter store failures and timeouts by operation</li>
 *   <li>{@code deskgate.admission.releases} - Slots given back by the post-request hook</li>
 *   <li>{@code deskgate.upload.verdicts} - Upload verdicts by outcome and reason</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.metricsEnabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordAdmission(RouteClass routeClass, AdmissionDecision decision) {
        if (!enabled) {
            return;
        }

        Counter.builder("deskgate.admission.checks")
                .description("Admission decisions")
                .tag("route_class", routeClass.configName())
                .tag("outcome", outcomeTag(decision.outcome()))
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreFailure(String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("deskgate.admission.store.failures")
                .description("Counter store failures and timeouts; each one admitted a request unchecked")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordRelease(RouteClass routeClass) {
        if (!enabled) {
            return;
        }

        Counter.builder("deskgate.admission.releases")
                .description("Rate limit slots released after the response")
                .tag("route_class", routeClass.configName())
                .register(registry)
                .increment();
    }

    @Override
    public void recordUploadVerdict(ValidationVerdict verdict) {
        if (!enabled) {
            return;
        }

        final var reason = verdict instanceof ValidationVerdict.Rejected rejected
                ? rejected.reason().code()
                : "none";
        Counter.builder("deskgate.upload.verdicts")
                .description("Upload validation verdicts")
                .tag("outcome", verdict.accepted() ? "accepted" : "rejected")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    private static String outcomeTag(AdmissionDecision.Outcome outcome) {
        return switch (outcome) {
            case ADMITTED -> "admitted";
            case REJECTED -> "rejected";
            case FAIL_OPEN -> "fail_open";
            case UNLIMITED -> "unlimited";
        };
    }
}
