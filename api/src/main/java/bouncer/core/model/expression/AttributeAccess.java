package bouncer.core.model.expression;

import java.util.Map;

import bouncer.core.model.EnforcementException;

/**
 * Attribute lookup on a structured request value, e.g. {@code r.obj.owner}.
 *
 * <p>The target must evaluate to a {@link Map}; a missing attribute is an error
 * rather than a silent mismatch.
 */
public record AttributeAccess(Expression target, String attribute) implements Expression {

    @Override
    public Object evaluate(EvaluationContext context) {
        final var value = target.evaluate(context);
        if (!(value instanceof Map<?, ?> attributes)) {
            throw new EnforcementException("Cannot read attribute '" + attribute + "' of " + target
                    + ": value is not a structured object");
        }
        if (!attributes.containsKey(attribute)) {
            throw new EnforcementException("Unknown attribute '" + attribute + "' on " + target);
        }
        return attributes.get(attribute);
    }

    @Override
    public boolean referencesPolicy() {
        return target.referencesPolicy();
    }

    @Override
    public String toString() {
        return target + "." + attribute;
    }
}
