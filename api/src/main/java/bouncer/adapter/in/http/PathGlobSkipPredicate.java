package bouncer.adapter.in.http;

import java.util.List;

import bouncer.core.model.definition.MatchingOptions;
import bouncer.core.service.function.GlobPatternMatcher;

/**
 * Skips requests whose path matches one of a list of glob patterns,
 * such as {@code /q/**} or {@code /health}.
 */
public class PathGlobSkipPredicate implements SkipPredicate {

    private final List<String> patterns;
    private final GlobPatternMatcher matcher = new GlobPatternMatcher(MatchingOptions.defaults());

    public PathGlobSkipPredicate(List<String> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    @Override
    public boolean shouldSkip(String path, String method) {
        for (var pattern : patterns) {
            if (matcher.matches(path, pattern)) {
                return true;
            }
        }
        return false;
    }
}
