package bouncer.core.model.expression;

/**
 * A node of a compiled matcher expression.
 *
 * <p>Expressions are immutable and resolved at compile time: field references
 * carry their binding index and function calls carry their implementation, so
 * evaluation never looks anything up by name.
 */
public sealed interface Expression
        permits Literal, FieldReference, AttributeAccess, Not, BinaryOperation, Membership, FunctionCall {

    /**
     * Evaluate this node.
     *
     * @param context the bindings for the current request and policy rule
     * @return the value; a {@link Boolean} for predicates
     * @throws bouncer.core.model.EnforcementException on type or function errors
     */
    Object evaluate(EvaluationContext context);

    /**
     * @return true if this node or any child references a policy field
     */
    boolean referencesPolicy();
}
