package bouncer.core.service.function;

import bouncer.core.model.expression.MatcherFunction;

/**
 * A named matcher function and the number of arguments it takes.
 *
 * @param name     the name used in matcher expressions
 * @param arity    the required argument count, or {@link #VARIADIC}
 * @param function the implementation
 */
public record FunctionDefinition(String name, int arity, MatcherFunction function) {

    public static final int VARIADIC = -1;

    public FunctionDefinition {
        if (name == null || !name.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("Invalid function name: " + name);
        }
        if (function == null) {
            throw new IllegalArgumentException("Function implementation cannot be null");
        }
    }

    public boolean accepts(int argumentCount) {
        return arity == VARIADIC || arity == argumentCount;
    }
}
