package deskgate.core.service.admission;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Route-class path patterns.
 *
 * <p>Patterns use filesystem glob syntax: {@code *} stays inside one path segment and
 * {@code **} spans segments, so {@code /api/search/**} covers every search endpoint but not
 * {@code /api/search} itself. Compiled patterns are kept for the life of the bean.
 */
@ApplicationScoped
public class GlobPatternMatcher {

    private static final Pattern SLASH_RUNS = Pattern.compile("/{2,}");

    private final Map<String, PathMatcher> compiled = new ConcurrentHashMap<>();

    /**
     * Whether a request path falls under a route pattern.
     *
     * @param glob the route pattern, e.g. {@code /api/auth/login} or {@code /api/files/**}
     * @param path the raw request path, possibly with a query string
     * @return true when the pattern covers the path
     */
    public boolean matches(String glob, String path) {
        final var matcher = compiled.computeIfAbsent(
                glob, pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern));
        return matcher.matches(Path.of(normalizePath(path)));
    }

    /**
     * Canonical form used for matching: no query string, single slashes, no trailing slash.
     * An empty or missing path is the root.
     */
    static String normalizePath(String path) {
        if (path == null) {
            return "/";
        }
        final var queryStart = path.indexOf('?');
        final var withoutQuery = queryStart < 0 ? path : path.substring(0, queryStart);
        final var collapsed = SLASH_RUNS.matcher(withoutQuery).replaceAll("/");

        var end = collapsed.length();
        while (end > 1 && collapsed.charAt(end - 1) == '/') {
            end--;
        }
        final var trimmed = collapsed.substring(0, end);
        return trimmed.isEmpty() ? "/" : trimmed;
    }
}
