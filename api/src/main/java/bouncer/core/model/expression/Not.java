package bouncer.core.model.expression;

/**
 * Logical negation.
 */
public record Not(Expression operand) implements Expression {

    @Override
    public Object evaluate(EvaluationContext context) {
        return !Values.asBoolean(operand.evaluate(context), "!");
    }

    @Override
    public boolean referencesPolicy() {
        return operand.referencesPolicy();
    }
}
