package bouncer.core.model.definition;

/**
 * Comparison behaviour fixed when a model is compiled.
 *
 * @param caseSensitive whether string equality, {@code in} and pattern functions respect case
 * @param patternMode   the pattern syntax accepted by the matching functions
 */
public record MatchingOptions(boolean caseSensitive, PatternMode patternMode) {

    private static final MatchingOptions DEFAULTS = new MatchingOptions(true, PatternMode.FULL);

    public MatchingOptions {
        if (patternMode == null) {
            patternMode = PatternMode.FULL;
        }
    }

    public static MatchingOptions defaults() {
        return DEFAULTS;
    }

    public MatchingOptions withCaseSensitive(boolean value) {
        return new MatchingOptions(value, patternMode);
    }

    public MatchingOptions withPatternMode(PatternMode value) {
        return new MatchingOptions(caseSensitive, value);
    }
}
