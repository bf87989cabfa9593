package bouncer.core.model.definition;

/**
 * How much pattern syntax the matching functions accept.
 */
public enum PatternMode {
    /**
     * Full glob syntax for {@code globMatch} and regular expressions for {@code regexMatch}.
     */
    FULL,

    /**
     * Only leading or trailing {@code *} wildcards; {@code regexMatch} is not available.
     */
    WILDCARD
}
