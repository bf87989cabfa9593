package bouncer.core.model.expression;

/**
 * Compiles rule text stored in policy fields for the {@code eval} function.
 */
@FunctionalInterface
public interface RuleCompiler {

    /**
     * @param ruleText the expression text
     * @return the compiled expression
     * @throws bouncer.core.model.EnforcementException if the text does not compile
     */
    Expression compile(String ruleText);
}
