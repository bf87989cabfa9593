package bouncer.core.service.function;

import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import bouncer.core.cache.CaffeinePatternCache;
import bouncer.core.cache.PatternCache;
import bouncer.core.model.EnforcementException;
import bouncer.core.model.definition.MatchingOptions;

/**
 * URL and pattern matching functions available to matchers.
 *
 * <ul>
 *   <li>{@code keyMatch("/foo/bar", "/foo/*")} - {@code *} matches the rest of the key</li>
 *   <li>{@code keyMatch2("/foo/bar", "/foo/:id")} - {@code :name} matches one path segment</li>
 *   <li>{@code keyMatch3("/foo/bar", "/foo/{id}")} - {@code {name}} matches one path segment</li>
 *   <li>{@code regexMatch("/foo/bar", "^/foo/.*")} - regular expression search</li>
 * </ul>
 */
public class KeyMatchFunctions {

    private static final Pattern STAR_SEGMENT = Pattern.compile("/\\*");
    private static final Pattern COLON_PARAMETER = Pattern.compile(":[^/]+");
    private static final Pattern BRACE_PARAMETER = Pattern.compile("\\{[^/]+?}");

    private final MatchingOptions options;
    private final PatternCache<String, Pattern> patternCache;

    public KeyMatchFunctions(MatchingOptions options) {
        this(options, new CaffeinePatternCache<>());
    }

    KeyMatchFunctions(MatchingOptions options, PatternCache<String, Pattern> patternCache) {
        this.options = options;
        this.patternCache = patternCache;
    }

    public boolean keyMatch(String key, String pattern) {
        final var k = fold(key);
        final var p = fold(pattern);
        final var star = p.indexOf('*');
        if (star < 0) {
            return k.equals(p);
        }
        if (k.length() > star) {
            return k.substring(0, star).equals(p.substring(0, star));
        }
        return k.equals(p.substring(0, star));
    }

    public boolean keyMatch2(String key, String pattern) {
        var regex = STAR_SEGMENT.matcher(pattern).replaceAll("/.*");
        regex = COLON_PARAMETER.matcher(regex).replaceAll("[^/]+");
        return compile("^" + regex + "$").matcher(key).matches();
    }

    public boolean keyMatch3(String key, String pattern) {
        var regex = STAR_SEGMENT.matcher(pattern).replaceAll("/.*");
        regex = BRACE_PARAMETER.matcher(regex).replaceAll("[^/]+?");
        return compile("^" + regex + "$").matcher(key).matches();
    }

    public boolean regexMatch(String key, String regex) {
        return compile(regex).matcher(key).find();
    }

    private Pattern compile(String regex) {
        return patternCache.get(regex, r -> {
            try {
                return options.caseSensitive() ? Pattern.compile(r) : Pattern.compile(r, Pattern.CASE_INSENSITIVE);
            } catch (PatternSyntaxException e) {
                throw new EnforcementException("Invalid pattern '" + r + "': " + e.getDescription(), e);
            }
        });
    }

    private String fold(String value) {
        return options.caseSensitive() ? value : value.toLowerCase(Locale.ROOT);
    }
}
