package bouncer.core.service.function;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import bouncer.core.model.EnforcementException;
import bouncer.core.model.definition.MatchingOptions;
import bouncer.core.model.definition.PatternMode;
import bouncer.core.model.expression.EvaluationContext;
import bouncer.core.model.expression.MatcherFunction;

/**
 * Name-to-implementation table consulted when a matcher is compiled.
 *
 * <p>Function names are resolved once at compile time, so calling an unknown
 * function is a compile error. Registries are immutable; {@link #with}
 * returns an extended copy.
 */
public final class FunctionRegistry {

    public static final String EVAL = "eval";

    private final Map<String, FunctionDefinition> functions;

    private FunctionRegistry(Map<String, FunctionDefinition> functions) {
        this.functions = Collections.unmodifiableMap(functions);
    }

    /**
     * @return a registry with no functions at all
     */
    public static FunctionRegistry empty() {
        return new FunctionRegistry(new LinkedHashMap<>());
    }

    /**
     * Build the registry of built-in functions for the given options.
     *
     * <p>{@code regexMatch} is only registered in {@link PatternMode#FULL}.
     *
     * @param options comparison options
     * @return the built-in registry
     */
    public static FunctionRegistry builtins(MatchingOptions options) {
        final var keys = new KeyMatchFunctions(options);
        final var globs = new GlobPatternMatcher(options);
        final var ips = new IpMatcher();

        final Map<String, FunctionDefinition> functions = new LinkedHashMap<>();
        put(functions, "keyMatch", 2, (args, ctx) -> keys.keyMatch(string(args, 0, "keyMatch"), string(args, 1, "keyMatch")));
        put(functions, "keyMatch2", 2, (args, ctx) -> keys.keyMatch2(string(args, 0, "keyMatch2"), string(args, 1, "keyMatch2")));
        put(functions, "keyMatch3", 2, (args, ctx) -> keys.keyMatch3(string(args, 0, "keyMatch3"), string(args, 1, "keyMatch3")));
        put(functions, "globMatch", 2, (args, ctx) -> globs.matches(string(args, 0, "globMatch"), string(args, 1, "globMatch")));
        put(functions, "ipMatch", 2, (args, ctx) -> ips.matches(string(args, 0, "ipMatch"), string(args, 1, "ipMatch")));
        if (options.patternMode() == PatternMode.FULL) {
            put(functions, "regexMatch", 2, (args, ctx) -> keys.regexMatch(string(args, 0, "regexMatch"), string(args, 1, "regexMatch")));
        }
        put(functions, EVAL, 1, FunctionRegistry::evaluateRule);
        return new FunctionRegistry(functions);
    }

    /**
     * @param name     the function name
     * @param arity    the required argument count, or {@link FunctionDefinition#VARIADIC}
     * @param function the implementation
     * @return a copy of this registry including the function, replacing any previous one with that name
     */
    public FunctionRegistry with(String name, int arity, MatcherFunction function) {
        final Map<String, FunctionDefinition> copy = new LinkedHashMap<>(functions);
        put(copy, name, arity, function);
        return new FunctionRegistry(copy);
    }

    /**
     * @param other functions to add
     * @return a copy of this registry including every function of {@code other}
     */
    public FunctionRegistry with(FunctionRegistry other) {
        final Map<String, FunctionDefinition> copy = new LinkedHashMap<>(functions);
        copy.putAll(other.functions);
        return new FunctionRegistry(copy);
    }

    public Optional<FunctionDefinition> lookup(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    /**
     * Extract a string argument, failing on any other type.
     *
     * @param args     the evaluated arguments
     * @param index    the argument position
     * @param function the calling function, for diagnostics
     * @return the argument
     */
    public static String string(List<Object> args, int index, String function) {
        final var value = args.get(index);
        if (value instanceof String s) {
            return s;
        }
        throw new EnforcementException("Function '" + function + "' expects a string as argument " + (index + 1)
                + ", got " + (value == null ? "null" : value.getClass().getSimpleName()));
    }

    private static Object evaluateRule(List<Object> args, EvaluationContext context) {
        final var rule = string(args, 0, EVAL);
        final var result = context.compileRule(rule).evaluate(context);
        if (!(result instanceof Boolean)) {
            throw new EnforcementException("Rule '" + rule + "' did not evaluate to a boolean");
        }
        return result;
    }

    private static void put(Map<String, FunctionDefinition> target, String name, int arity, MatcherFunction fn) {
        target.put(name, new FunctionDefinition(name, arity, fn));
    }
}
