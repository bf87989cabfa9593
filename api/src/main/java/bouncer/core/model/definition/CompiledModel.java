package bouncer.core.model.definition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import bouncer.core.model.expression.Expression;
import bouncer.core.model.expression.RuleCompiler;

/**
 * The executable form of an access-control model.
 *
 * <p>A compiled model is immutable. Reloading a model produces a new instance.
 *
 * @param request      the request definition
 * @param policy       the policy definition
 * @param roles        role definitions by key, in declaration order
 * @param effect       how matching rules combine
 * @param matcher      the compiled matcher expression
 * @param matcherText  the matcher source, kept for diagnostics
 * @param options      comparison options
 * @param ruleCompiler compiler for rule text evaluated by {@code eval}
 */
public record CompiledModel(
        AssertionDefinition request,
        AssertionDefinition policy,
        Map<String, RoleDefinition> roles,
        PolicyEffect effect,
        Expression matcher,
        String matcherText,
        MatchingOptions options,
        RuleCompiler ruleCompiler) {

    public static final String POLICY_KEY = "p";
    public static final String EFFECT_FIELD = "eft";
    public static final String PRIORITY_FIELD = "priority";

    public CompiledModel {
        roles = Collections.unmodifiableMap(new LinkedHashMap<>(roles));
    }

    public Optional<RoleDefinition> role(String key) {
        return Optional.ofNullable(roles.get(key));
    }

    /**
     * @param section a policy storage section key
     * @return true if rules under that section are accepted by this model
     */
    public boolean acceptsSection(String section) {
        return POLICY_KEY.equals(section) || roles.containsKey(section);
    }

    /**
     * @param section a section accepted by this model
     * @return the number of values a rule in that section must carry
     */
    public int arityOf(String section) {
        if (POLICY_KEY.equals(section)) {
            return policy.arity();
        }
        final var role = roles.get(section);
        if (role == null) {
            throw new IllegalArgumentException("Unknown policy section: " + section);
        }
        return role.arity();
    }

    public OptionalInt effectIndex() {
        return policy.indexOf(EFFECT_FIELD);
    }

    public OptionalInt priorityIndex() {
        return policy.indexOf(PRIORITY_FIELD);
    }
}
