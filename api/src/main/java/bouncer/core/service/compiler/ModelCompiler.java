package bouncer.core.service.compiler;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.jboss.logging.Logger;

import bouncer.core.cache.CaffeinePatternCache;
import bouncer.core.cache.PatternCache;
import bouncer.core.model.EnforcementException;
import bouncer.core.model.ModelCompileException;
import bouncer.core.model.definition.AssertionDefinition;
import bouncer.core.model.definition.CompiledModel;
import bouncer.core.model.definition.MatchingOptions;
import bouncer.core.model.definition.PolicyEffect;
import bouncer.core.model.definition.RoleDefinition;
import bouncer.core.model.expression.Expression;
import bouncer.core.model.expression.RuleCompiler;
import bouncer.core.model.policy.RoleLink;
import bouncer.core.service.function.FunctionRegistry;

/**
 * Compiles section-based model text into a {@link CompiledModel}.
 *
 * <pre>
 * [request_definition]
 * r = sub, obj, act
 *
 * [policy_definition]
 * p = sub, obj, act
 *
 * [role_definition]
 * g = _, _
 *
 * [policy_effect]
 * e = some(where (p.eft == allow))
 *
 * [matchers]
 * m = g(r.sub, p.sub) &amp;&amp; r.obj == p.obj &amp;&amp; r.act == p.act
 * </pre>
 *
 * <p>Lines starting with {@code #} are comments and a trailing {@code \}
 * continues a value on the next line. The compiler itself is stateless and
 * thread-safe; every call produces an independent model.
 */
public class ModelCompiler {

    private static final Logger LOG = Logger.getLogger(ModelCompiler.class);

    static final String REQUEST_SECTION = "request_definition";
    static final String POLICY_SECTION = "policy_definition";
    static final String ROLE_SECTION = "role_definition";
    static final String EFFECT_SECTION = "policy_effect";
    static final String MATCHERS_SECTION = "matchers";

    private static final Pattern FIELD_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern ROLE_KEY = Pattern.compile("g[0-9]*");
    private static final String ROLE_PLACEHOLDER = "_";

    private static final Map<String, Set<String>> SECTION_KEYS = Map.of(
            REQUEST_SECTION, Set.of("r"),
            POLICY_SECTION, Set.of(CompiledModel.POLICY_KEY),
            EFFECT_SECTION, Set.of("e"),
            MATCHERS_SECTION, Set.of("m"));

    private final MatchingOptions options;
    private final FunctionRegistry customFunctions;

    public ModelCompiler() {
        this(MatchingOptions.defaults(), FunctionRegistry.empty());
    }

    /**
     * @param options         comparison options baked into compiled models
     * @param customFunctions functions available to matchers in addition to the built-ins
     */
    public ModelCompiler(MatchingOptions options, FunctionRegistry customFunctions) {
        this.options = options;
        this.customFunctions = customFunctions;
    }

    public MatchingOptions options() {
        return options;
    }

    /**
     * Compile model text.
     *
     * @param modelText the model description
     * @return the compiled model
     * @throws ModelCompileException if the text is malformed or references undeclared names
     */
    public CompiledModel compile(String modelText) {
        if (modelText == null || modelText.isBlank()) {
            throw new ModelCompileException(null, "Model text is empty");
        }
        final var sections = parseSections(modelText);

        final var request = assertion(sections, REQUEST_SECTION, "r");
        final var policy = assertion(sections, POLICY_SECTION, CompiledModel.POLICY_KEY);
        final var roles = roles(sections.getOrDefault(ROLE_SECTION, Map.of()));
        final var effect = effect(sections);
        final var matcherText = required(sections, MATCHERS_SECTION, "m");

        if (effect != PolicyEffect.ALLOW_OVERRIDE && !policy.declares(CompiledModel.EFFECT_FIELD)) {
            LOG.debugf("Effect %s without an eft field: every matching rule counts as allow", effect);
        }

        final var registry = FunctionRegistry.builtins(options)
                .with(customFunctions)
                .with(roleFunctions(roles));

        final var matcher = new ExpressionParser(request, policy, registry, MATCHERS_SECTION).parse(matcherText);
        final var ruleCompiler = ruleCompiler(request, policy, registry);

        LOG.infof(
                "Compiled model: %d request field(s), %d policy field(s), %d role definition(s), effect %s",
                request.arity(),
                policy.arity(),
                roles.size(),
                effect);
        return new CompiledModel(request, policy, roles, effect, matcher, matcherText, options, ruleCompiler);
    }

    private Map<String, Map<String, String>> parseSections(String text) {
        final Map<String, Map<String, String>> sections = new LinkedHashMap<>();
        final var lines = text.split("\\r?\\n", -1);

        String current = null;
        String pendingKey = null;
        StringBuilder pendingValue = null;

        for (var lineNumber = 1; lineNumber <= lines.length; lineNumber++) {
            final var line = lines[lineNumber - 1].trim();

            if (pendingKey != null) {
                final var continues = line.endsWith("\\");
                pendingValue.append(' ').append(continues ? line.substring(0, line.length() - 1).trim() : line);
                if (!continues) {
                    put(sections, current, pendingKey, pendingValue.toString().trim(), lineNumber);
                    pendingKey = null;
                    pendingValue = null;
                }
                continue;
            }

            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("[")) {
                if (!line.endsWith("]")) {
                    throw new ModelCompileException(null, "Malformed section header at line " + lineNumber + ": " + line);
                }
                current = line.substring(1, line.length() - 1).trim();
                if (!SECTION_KEYS.containsKey(current) && !ROLE_SECTION.equals(current)) {
                    throw new ModelCompileException(current, "Unknown section at line " + lineNumber);
                }
                if (sections.containsKey(current)) {
                    throw new ModelCompileException(current, "Section declared twice at line " + lineNumber);
                }
                sections.put(current, new LinkedHashMap<>());
                continue;
            }
            if (current == null) {
                throw new ModelCompileException(null, "Definition outside of any section at line " + lineNumber);
            }

            final var equals = line.indexOf('=');
            if (equals <= 0) {
                throw new ModelCompileException(current, "Expected 'key = value' at line " + lineNumber);
            }
            final var key = line.substring(0, equals).trim();
            final var value = line.substring(equals + 1).trim();
            if (value.endsWith("\\")) {
                pendingKey = key;
                pendingValue = new StringBuilder(value.substring(0, value.length() - 1).trim());
                continue;
            }
            put(sections, current, key, value, lineNumber);
        }

        if (pendingKey != null) {
            put(sections, current, pendingKey, pendingValue.toString().trim(), lines.length);
        }
        return sections;
    }

    private void put(Map<String, Map<String, String>> sections, String section, String key, String value, int line) {
        final var allowed = SECTION_KEYS.get(section);
        final var valid = allowed == null ? ROLE_KEY.matcher(key).matches() : allowed.contains(key);
        if (!valid) {
            throw new ModelCompileException(section, "Unknown key '" + key + "' at line " + line);
        }
        final var entries = sections.get(section);
        if (entries.containsKey(key)) {
            throw new ModelCompileException(section, "Key '" + key + "' declared twice at line " + line);
        }
        entries.put(key, value);
    }

    private String required(Map<String, Map<String, String>> sections, String section, String key) {
        final var entries = sections.get(section);
        if (entries == null) {
            throw new ModelCompileException(section, "Missing required section");
        }
        final var value = entries.get(key);
        if (value == null || value.isEmpty()) {
            throw new ModelCompileException(section, "Missing definition for '" + key + "'");
        }
        return value;
    }

    private AssertionDefinition assertion(Map<String, Map<String, String>> sections, String section, String key) {
        final var fields = splitList(section, required(sections, section, key));
        final Set<String> seen = new HashSet<>();
        for (var field : fields) {
            if (!FIELD_NAME.matcher(field).matches()) {
                throw new ModelCompileException(section, "Invalid field name '" + field + "'");
            }
            if (!seen.add(field)) {
                throw new ModelCompileException(section, "Field '" + field + "' declared twice");
            }
        }
        return new AssertionDefinition(key, fields);
    }

    private Map<String, RoleDefinition> roles(Map<String, String> entries) {
        final Map<String, RoleDefinition> roles = new LinkedHashMap<>();
        entries.forEach((key, value) -> {
            final var placeholders = splitList(ROLE_SECTION, value);
            if (!placeholders.stream().allMatch(ROLE_PLACEHOLDER::equals)) {
                throw new ModelCompileException(ROLE_SECTION, "Role definition '" + key + "' must only contain '_'");
            }
            if (placeholders.size() != RoleDefinition.PLAIN_ARITY && placeholders.size() != RoleDefinition.DOMAIN_ARITY) {
                throw new ModelCompileException(
                        ROLE_SECTION, "Role definition '" + key + "' must declare 2 or 3 fields, got " + placeholders.size());
            }
            roles.put(key, new RoleDefinition(key, placeholders.size()));
        });
        return roles;
    }

    private PolicyEffect effect(Map<String, Map<String, String>> sections) {
        final var text = required(sections, EFFECT_SECTION, "e");
        return PolicyEffect.fromExpression(text)
                .orElseThrow(() -> new ModelCompileException(EFFECT_SECTION, "Unsupported effect '" + text + "'"));
    }

    private FunctionRegistry roleFunctions(Map<String, RoleDefinition> roles) {
        var registry = FunctionRegistry.empty();
        for (var role : roles.values()) {
            final var key = role.key();
            registry = registry.with(key, role.arity(), (args, ctx) -> ctx.hasRoleLink(
                    key,
                    FunctionRegistry.string(args, 0, key),
                    FunctionRegistry.string(args, 1, key),
                    role.hasDomain() ? FunctionRegistry.string(args, 2, key) : RoleLink.NO_DOMAIN));
        }
        return registry;
    }

    private RuleCompiler ruleCompiler(AssertionDefinition request, AssertionDefinition policy, FunctionRegistry registry) {
        final PatternCache<String, Expression> cache = new CaffeinePatternCache<>();
        return ruleText -> cache.get(ruleText, text -> {
            try {
                return new ExpressionParser(request, policy, registry, FunctionRegistry.EVAL).parse(text);
            } catch (ModelCompileException e) {
                throw new EnforcementException("Invalid rule '" + text + "': " + e.getMessage(), e);
            }
        });
    }

    private static List<String> splitList(String section, String value) {
        final List<String> items = new ArrayList<>();
        for (var item : value.split(",", -1)) {
            final var trimmed = item.trim();
            if (trimmed.isEmpty()) {
                throw new ModelCompileException(section, "Empty entry in '" + value + "'");
            }
            items.add(trimmed);
        }
        return items;
    }
}
