package bouncer.core.service.function;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Locale;
import java.util.regex.Pattern;

import bouncer.core.cache.CaffeinePatternCache;
import bouncer.core.cache.PatternCache;
import bouncer.core.model.definition.MatchingOptions;
import bouncer.core.model.definition.PatternMode;

/**
 * Matches paths against glob patterns.
 *
 * <p>In {@link PatternMode#FULL} the pattern uses Java's glob syntax through
 * {@link PathMatcher} ({@code *}, {@code **}, {@code ?}, {@code [...]}, {@code {a,b}}).
 * In {@link PatternMode#WILDCARD} only a leading and/or trailing {@code *} is
 * special and everything else is compared literally.
 *
 * <p>Compiled matchers are cached.
 */
public class GlobPatternMatcher {

    // Pre-compiled pattern for collapsing multiple slashes
    private static final Pattern MULTIPLE_SLASHES = Pattern.compile("/+");
    private static final String WILDCARD = "*";

    private final MatchingOptions options;
    private final PatternCache<String, PathMatcher> matcherCache;

    public GlobPatternMatcher(MatchingOptions options) {
        this(options, new CaffeinePatternCache<>());
    }

    GlobPatternMatcher(MatchingOptions options, PatternCache<String, PathMatcher> matcherCache) {
        this.options = options;
        this.matcherCache = matcherCache;
    }

    /**
     * Tests if a path matches a glob pattern.
     *
     * @param path the path to test
     * @param glob the glob pattern (e.g., "/api/users/**", "/api/health")
     * @return true if the path matches the pattern
     */
    public boolean matches(String path, String glob) {
        final var subject = fold(path);
        final var pattern = fold(glob);
        if (options.patternMode() == PatternMode.WILDCARD) {
            return matchesWildcard(subject, pattern);
        }
        final var matcher = matcherCache.get(pattern, this::createMatcher);
        return matcher.matches(Path.of(normalizePath(subject)));
    }

    private boolean matchesWildcard(String value, String pattern) {
        if (WILDCARD.equals(pattern)) {
            return true;
        }
        final var leading = pattern.startsWith(WILDCARD);
        final var trailing = pattern.length() > 1 && pattern.endsWith(WILDCARD);
        final var core = pattern.substring(leading ? 1 : 0, pattern.length() - (trailing ? 1 : 0));
        if (leading && trailing) {
            return value.contains(core);
        }
        if (leading) {
            return value.endsWith(core);
        }
        if (trailing) {
            return value.startsWith(core);
        }
        return value.equals(core);
    }

    private PathMatcher createMatcher(String glob) {
        return FileSystems.getDefault().getPathMatcher("glob:" + glob);
    }

    private String fold(String value) {
        return options.caseSensitive() ? value : value.toLowerCase(Locale.ROOT);
    }

    /**
     * Normalizes a path by removing trailing slashes and collapsing multiple slashes.
     */
    private String normalizePath(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }

        var normalized = MULTIPLE_SLASHES.matcher(path).replaceAll("/");

        // Remove trailing slash (but keep root slash)
        if (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }

        return normalized;
    }
}
