package bouncer.core.model.expression;

import java.util.ArrayList;
import java.util.List;

import bouncer.core.model.EnforcementException;
import bouncer.core.model.PolicyEngineException;

/**
 * A call to a registered matcher function, resolved at compile time.
 */
public record FunctionCall(String name, MatcherFunction function, List<Expression> arguments)
        implements Expression {

    public FunctionCall {
        arguments = List.copyOf(arguments);
    }

    @Override
    public Object evaluate(EvaluationContext context) {
        final List<Object> values = new ArrayList<>(arguments.size());
        for (var argument : arguments) {
            values.add(argument.evaluate(context));
        }
        try {
            return function.apply(values, context);
        } catch (PolicyEngineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EnforcementException("Function '" + name + "' failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean referencesPolicy() {
        return arguments.stream().anyMatch(Expression::referencesPolicy);
    }

    @Override
    public String toString() {
        return name + arguments.toString().replace('[', '(').replace(']', ')');
    }
}
