package deskgate.core.service.admission;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import deskgate.core.config.AdmissionConfig;
import deskgate.core.model.admission.RateLimitPolicy;
import deskgate.core.model.admission.RouteClass;

/**
 * Holds the effective rate limit policy of every route class.
 *
 * <p>Policies are built once at startup from the reference table, with any configured
 * overrides applied field by field, and never change afterwards.
 *
 * <table>
 *   <caption>Reference policies</caption>
 *   <tr><th>route class</th><th>window</th><th>max</th><th>key</th></tr>
 *   <tr><td>authentication</td><td>15 min</td><td>5</td><td>IP + identifier, successes not counted</td></tr>
 *   <tr><td>general</td><td>15 min</td><td>100</td><td>IP</td></tr>
 *   <tr><td>strict</td><td>1 min</td><td>10</td><td>IP</td></tr>
 *   <tr><td>upload</td><td>1 min</td><td>5</td><td>IP + caller</td></tr>
 *   <tr><td>authenticated-api</td><td>1 min</td><td>60</td><td>caller or IP</td></tr>
 *   <tr><td>search</td><td>1 min</td><td>20</td><td>caller or IP</td></tr>
 * </table>
 */
@ApplicationScoped
public class PolicyRegistry {

    private static final Logger LOG = Logger.getLogger(PolicyRegistry.class);

    private final Map<RouteClass, RateLimitPolicy> policies;

    @Inject
    public PolicyRegistry(AdmissionConfig config) {
        this(buildPolicies(config));
    }

    public PolicyRegistry(Map<RouteClass, RateLimitPolicy> policies) {
        this.policies = new EnumMap<>(policies);
    }

    /**
     * The reference policy for a route class.
     *
     * @param routeClass the route class
     * @param identifierField body field used by the authentication key
     * @return the policy
     */
    public static RateLimitPolicy reference(RouteClass routeClass, String identifierField) {
        return switch (routeClass) {
            case AUTHENTICATION -> RateLimitPolicy.of(
                            routeClass, Duration.ofMinutes(15), 5, KeyGenerators.ipAndIdentifier(identifierField))
                    .skippingSuccessful();
            case GENERAL -> RateLimitPolicy.of(routeClass, Duration.ofMinutes(15), 100, KeyGenerators.ip());
            case STRICT -> RateLimitPolicy.of(routeClass, Duration.ofMinutes(1), 10, KeyGenerators.ip());
            case UPLOAD -> RateLimitPolicy.of(routeClass, Duration.ofMinutes(1), 5, KeyGenerators.ipAndCaller());
            case AUTHENTICATED_API -> RateLimitPolicy.of(
                    routeClass, Duration.ofMinutes(1), 60, KeyGenerators.callerOrIp());
            case SEARCH -> RateLimitPolicy.of(routeClass, Duration.ofMinutes(1), 20, KeyGenerators.callerOrIp());
        };
    }

    /**
     * The effective policy for a route class.
     *
     * @param routeClass the route class
     * @return the policy, empty when the class is not limited
     */
    public Optional<RateLimitPolicy> policyFor(RouteClass routeClass) {
        return Optional.ofNullable(policies.get(routeClass));
    }

    private static Map<RouteClass, RateLimitPolicy> buildPolicies(AdmissionConfig config) {
        final var built = new EnumMap<RouteClass, RateLimitPolicy>(RouteClass.class);
        for (final var routeClass : RouteClass.values()) {
            final var reference = reference(routeClass, config.identifierField());
            final var override = config.policies().get(routeClass.configName());
            final var policy = override == null ? reference : applyOverride(reference, override);
            built.put(routeClass, policy);
            LOG.debugv(
                    "Route class {0}: {1} requests per {2} ms",
                    routeClass.configName(), policy.maxRequests(), policy.windowMs());
        }
        for (final var name : config.policies().keySet()) {
            try {
                RouteClass.fromConfigName(name);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown route class in deskgate.admission.policies: " + name, e);
            }
        }
        return built;
    }

    private static RateLimitPolicy applyOverride(RateLimitPolicy reference, AdmissionConfig.PolicyConfig override) {
        return new RateLimitPolicy(
                reference.routeClass(),
                override.window().map(Duration::toMillis).orElse(reference.windowMs()),
                override.maxRequests().orElse(reference.maxRequests()),
                reference.keyGenerator(),
                override.skipSuccessful().orElse(reference.skipOnSuccess()),
                override.skipFailed().orElse(reference.skipOnFailure()));
    }
}
