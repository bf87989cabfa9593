package bouncer.core.model.expression;

/**
 * A constant string, number or boolean.
 */
public record Literal(Object value) implements Expression {

    @Override
    public Object evaluate(EvaluationContext context) {
        return value;
    }

    @Override
    public boolean referencesPolicy() {
        return false;
    }
}
