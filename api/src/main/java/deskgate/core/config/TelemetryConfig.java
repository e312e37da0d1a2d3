package deskgate.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for telemetry.
 *
 * <p>Configuration prefix: {@code deskgate.telemetry}
 */
@ConfigMapping(prefix = "deskgate.telemetry")
public interface TelemetryConfig {

    /**
     * Record Micrometer meters for admission and upload outcomes.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean metricsEnabled();
}
