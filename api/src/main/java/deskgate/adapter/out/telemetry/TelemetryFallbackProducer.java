package deskgate.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Default;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.quarkus.arc.DefaultBean;

/**
 * Provides a fallback meter registry when the Micrometer extension does not provide one
 * (e.g., when metrics are disabled).
 */
@ApplicationScoped
public class TelemetryFallbackProducer {

    /**
     * Provides a fallback MeterRegistry when Micrometer is disabled.
     *
     * @return a simple in-memory meter registry
     */
    @Produces
    @Singleton
    @DefaultBean
    @Default
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
