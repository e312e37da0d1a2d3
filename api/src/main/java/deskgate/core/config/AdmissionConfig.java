package deskgate.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for request admission (rate limiting).
 *
 * <p>Configuration prefix: {@code deskgate.admission}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code DESKGATE_ADMISSION_ENABLED} - Enable/disable admission control</li>
 *   <li>{@code DESKGATE_ADMISSION_STORE} - Counter store: REDIS or MEMORY</li>
 *   <li>{@code REDIS_URL} - Shared store connection URL; when absent every check fails open</li>
 * </ul>
 */
@ConfigMapping(prefix = "deskgate.admission")
public interface AdmissionConfig {

    /**
     * Enable or disable admission control globally.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Counter store backend.
     *
     * @return the store type (default: REDIS)
     */
    @WithDefault("REDIS")
    StoreType store();

    /**
     * Namespace prepended to every rate limit key.
     *
     * @return key prefix (default: "rate_limit:")
     */
    @WithDefault("rate_limit:")
    String keyPrefix();

    /**
     * Include X-RateLimit-* headers in admitted responses.
     *
     * @return true to include headers (default: true)
     */
    @WithDefault("true")
    boolean includeHeaders();

    /**
     * Take the client IP from Forwarded / X-Forwarded-For.
     *
     * <p>Only enable behind a proxy that overwrites these headers.
     *
     * @return true to trust forwarding headers (default: false)
     */
    @WithDefault("false")
    boolean trustForwardedHeaders();

    /**
     * Body field the authentication key generator reads.
     *
     * @return field name (default: email)
     */
    @WithDefault("email")
    String identifierField();

    /**
     * Redis connection settings.
     */
    RedisConfig redis();

    /**
     * Per route class overrides of the reference policies, keyed by kebab-case route class name.
     */
    Map<String, PolicyConfig> policies();

    /**
     * Counter store backends.
     */
    enum StoreType {
        REDIS,
        MEMORY
    }

    /**
     * Redis-specific settings.
     */
    interface RedisConfig {

        /**
         * Connection URL, e.g. {@code redis://localhost:6379}.
         *
         * @return the URL, empty when the store is not configured
         */
        Optional<String> url();

        /**
         * Client-side timeout per store command. Expiry fails the check open.
         *
         * @return timeout (default: 500ms)
         */
        @WithDefault("500ms")
        Duration timeout();

        /**
         * How often a PING is sent while the store is down.
         *
         * @return probe interval (default: 10s)
         */
        @WithDefault("10s")
        Duration probeInterval();
    }

    /**
     * Overrides for one route class. Absent values keep the reference policy.
     */
    interface PolicyConfig {

        Optional<Duration> window();

        OptionalLong maxRequests();

        Optional<Boolean> skipSuccessful();

        Optional<Boolean> skipFailed();

        /**
         * Path globs that select this route class.
         */
        Optional<List<String>> paths();

        /**
         * HTTP methods that select this route class; empty means any method.
         */
        Optional<List<String>> methods();
    }
}
