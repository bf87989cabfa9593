package bouncer.core.model.definition;

import java.util.Arrays;
import java.util.Optional;

/**
 * How the results of individual matching rules combine into one decision.
 */
public enum PolicyEffect {

    /**
     * Allowed if at least one matching rule allows.
     */
    ALLOW_OVERRIDE("some(where(p.eft==allow))", false),

    /**
     * Allowed if at least one matching rule allows and none denies.
     */
    DENY_OVERRIDE("some(where(p.eft==allow))&&!some(where(p.eft==deny))", false),

    /**
     * Allowed unless a matching rule denies.
     */
    ALLOW_BY_DEFAULT("!some(where(p.eft==deny))", true),

    /**
     * Rules are tried in priority order and the first match decides.
     */
    PRIORITY("priority(p.eft)||deny", false);

    private final String canonicalExpression;
    private final boolean defaultDecision;

    PolicyEffect(String canonicalExpression, boolean defaultDecision) {
        this.canonicalExpression = canonicalExpression;
        this.defaultDecision = defaultDecision;
    }

    /**
     * @return the decision when no rule matches
     */
    public boolean defaultDecision() {
        return defaultDecision;
    }

    /**
     * Resolve an effect expression from the {@code policy_effect} section.
     *
     * <p>Whitespace is ignored.
     *
     * @param expression the effect expression text
     * @return the effect, or empty if the expression is not supported
     */
    public static Optional<PolicyEffect> fromExpression(String expression) {
        if (expression == null) {
            return Optional.empty();
        }
        final var normalized = expression.replaceAll("\\s+", "");
        return Arrays.stream(values())
                .filter(effect -> effect.canonicalExpression.equals(normalized))
                .findFirst();
    }
}
