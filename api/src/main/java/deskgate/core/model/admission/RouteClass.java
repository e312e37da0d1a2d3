package deskgate.core.model.admission;

import java.util.Locale;

/**
 * Classes of routes that share one rate limit policy.
 *
 * <p>Each class maps to exactly one {@link RateLimitPolicy}. The declaration order is
 * the order in which routes are classified: the first class whose patterns match a
 * request wins, so narrower classes come before {@link #GENERAL}.
 */
public enum RouteClass {
    AUTHENTICATION,
    STRICT,
    UPLOAD,
    SEARCH,
    AUTHENTICATED_API,
    GENERAL;

    /**
     * Return the kebab-case name used in configuration keys and metric tags.
     *
     * @return the configuration name (e.g. {@code authenticated-api})
     */
    public String configName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /**
     * Parse a configuration name back into a route class.
     *
     * @param configName kebab-case or enum-style name
     * @return the route class
     * @throws IllegalArgumentException if the name matches no route class
     */
    public static RouteClass fromConfigName(String configName) {
        return valueOf(configName.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
