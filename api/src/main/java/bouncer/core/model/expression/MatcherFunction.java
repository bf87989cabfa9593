package bouncer.core.model.expression;

import java.util.List;

/**
 * Implementation of a function callable from a matcher expression.
 *
 * <p>Functions must be pure: the result depends only on the arguments and the
 * read-only bindings exposed by the context.
 */
@FunctionalInterface
public interface MatcherFunction {

    /**
     * @param arguments the evaluated arguments
     * @param context   the current bindings
     * @return the function result
     */
    Object apply(List<Object> arguments, EvaluationContext context);
}
