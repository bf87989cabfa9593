package bouncer.core.model.expression;

import java.util.List;

/**
 * The {@code in} operator: {@code r.sub in ('alice', 'bob')}.
 */
public record Membership(Expression needle, List<Expression> candidates) implements Expression {

    public Membership {
        candidates = List.copyOf(candidates);
    }

    @Override
    public Object evaluate(EvaluationContext context) {
        final var value = needle.evaluate(context);
        for (var candidate : candidates) {
            if (Values.equal(value, candidate.evaluate(context), context.options())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean referencesPolicy() {
        return needle.referencesPolicy() || candidates.stream().anyMatch(Expression::referencesPolicy);
    }
}
