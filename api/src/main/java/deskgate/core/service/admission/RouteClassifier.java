package deskgate.core.service.admission;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import deskgate.core.config.AdmissionConfig;
import deskgate.core.model.admission.RouteClass;

/**
 * Maps a request's method and path to the route class whose policy applies.
 *
 * <p>Rules are tried in {@link RouteClass} declaration order and the first match wins.
 * Paths that match no rule are not limited.
 */
@ApplicationScoped
public class RouteClassifier {

    /**
     * Paths and methods that select one route class. An empty method set matches any method.
     */
    public record RouteRule(RouteClass routeClass, Set<String> methods, List<String> paths) {

        public RouteRule {
            methods = methods.stream().map(m -> m.toUpperCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
            paths = List.copyOf(paths);
        }

        boolean acceptsMethod(String method) {
            return methods.isEmpty() || methods.contains(method.toUpperCase(Locale.ROOT));
        }
    }

    private final GlobPatternMatcher matcher;
    private final List<RouteRule> rules;

    @Inject
    public RouteClassifier(GlobPatternMatcher matcher, AdmissionConfig config) {
        this(matcher, buildRules(config));
    }

    public RouteClassifier(GlobPatternMatcher matcher, List<RouteRule> rules) {
        this.matcher = matcher;
        this.rules = List.copyOf(rules);
    }

    /**
     * The reference routing table.
     *
     * @param routeClass the route class
     * @return its default rule
     */
    public static RouteRule reference(RouteClass routeClass) {
        return switch (routeClass) {
            case AUTHENTICATION -> new RouteRule(
                    routeClass, Set.of("POST"), List.of("/api/auth/login", "/api/auth/register"));
            case STRICT -> new RouteRule(routeClass, Set.of("POST"), List.of("/api/auth/forgot-password"));
            case UPLOAD -> new RouteRule(
                    routeClass, Set.of("POST"), List.of("/api/files/upload", "/api/files/upload-multiple"));
            case SEARCH -> new RouteRule(routeClass, Set.of(), List.of("/api/search", "/api/search/**"));
            case AUTHENTICATED_API -> new RouteRule(routeClass, Set.of(), List.of());
            case GENERAL -> new RouteRule(routeClass, Set.of(), List.of("/api/**"));
        };
    }

    /**
     * Classify a request.
     *
     * @param method the HTTP method
     * @param path the request path
     * @return the route class, empty when the request is not limited
     */
    public Optional<RouteClass> classify(String method, String path) {
        for (final var rule : rules) {
            if (!rule.acceptsMethod(method)) {
                continue;
            }
            for (final var glob : rule.paths()) {
                if (matcher.matches(glob, path)) {
                    return Optional.of(rule.routeClass());
                }
            }
        }
        return Optional.empty();
    }

    private static List<RouteRule> buildRules(AdmissionConfig config) {
        final var built = new ArrayList<RouteRule>();
        for (final var routeClass : RouteClass.values()) {
            final var reference = reference(routeClass);
            final var override = config.policies().get(routeClass.configName());
            if (override == null) {
                built.add(reference);
                continue;
            }
            built.add(new RouteRule(
                    routeClass,
                    override.methods().map(Set::copyOf).orElse(reference.methods()),
                    override.paths().orElse(reference.paths())));
        }
        return built;
    }
}
