package bouncer.core.model.expression;

import bouncer.core.model.definition.MatchingOptions;

/**
 * Bindings visible to a matcher expression while it is evaluated against one
 * request and one policy rule.
 *
 * <p>Implementations are created per evaluation and are never shared between
 * threads.
 */
public interface EvaluationContext {

    /**
     * @param index position in the request definition
     * @return the request value bound to that field
     */
    Object requestValue(int index);

    /**
     * @param index position in the policy definition
     * @return the value of the current policy rule at that field
     */
    Object policyValue(int index);

    /**
     * @return the comparison options the model was compiled with
     */
    MatchingOptions options();

    /**
     * Test role membership in the role graph declared under {@code roleKey}.
     *
     * @param roleKey the role definition key (e.g., "g", "g2")
     * @param subject the subject or role name
     * @param role    the role name
     * @param domain  the domain, or empty for un-scoped links
     * @return true if {@code subject} reaches {@code role}, directly or transitively
     */
    boolean hasRoleLink(String roleKey, String subject, String role, String domain);

    /**
     * Compile a rule expression stored inside a policy field.
     *
     * @param ruleText the expression text
     * @return the compiled expression, resolved against the same request and policy fields
     */
    Expression compileRule(String ruleText);
}
