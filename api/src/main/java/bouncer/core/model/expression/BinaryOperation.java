package bouncer.core.model.expression;

/**
 * An infix operation. {@code &&} and {@code ||} short-circuit.
 */
public record BinaryOperation(Operator operator, Expression left, Expression right) implements Expression {

    public enum Operator {
        OR("||"),
        AND("&&"),
        EQ("=="),
        NE("!="),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">="),
        PLUS("+");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    @Override
    public Object evaluate(EvaluationContext context) {
        final var symbol = operator.symbol();
        return switch (operator) {
            case OR -> Values.asBoolean(left.evaluate(context), symbol)
                    || Values.asBoolean(right.evaluate(context), symbol);
            case AND -> Values.asBoolean(left.evaluate(context), symbol)
                    && Values.asBoolean(right.evaluate(context), symbol);
            case EQ -> Values.equal(left.evaluate(context), right.evaluate(context), context.options());
            case NE -> !Values.equal(left.evaluate(context), right.evaluate(context), context.options());
            case LT -> Values.compare(left.evaluate(context), right.evaluate(context), symbol) < 0;
            case LE -> Values.compare(left.evaluate(context), right.evaluate(context), symbol) <= 0;
            case GT -> Values.compare(left.evaluate(context), right.evaluate(context), symbol) > 0;
            case GE -> Values.compare(left.evaluate(context), right.evaluate(context), symbol) >= 0;
            case PLUS -> Values.add(left.evaluate(context), right.evaluate(context));
        };
    }

    @Override
    public boolean referencesPolicy() {
        return left.referencesPolicy() || right.referencesPolicy();
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
