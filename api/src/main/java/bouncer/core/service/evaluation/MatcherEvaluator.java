package bouncer.core.service.evaluation;

import java.util.List;

import org.jboss.logging.Logger;

import bouncer.core.model.EnforcementException;
import bouncer.core.model.definition.CompiledModel;
import bouncer.core.model.definition.MatchingOptions;
import bouncer.core.model.expression.EvaluationContext;
import bouncer.core.model.expression.Expression;
import bouncer.core.model.policy.EnforcementResult;
import bouncer.core.model.policy.PolicyRule;
import bouncer.core.model.policy.RuleEffect;
import bouncer.core.service.policy.PolicyStore;

/**
 * Evaluates a request against a snapshot and combines the per-rule matcher
 * results according to the model's effect.
 *
 * <p>Evaluation only reads the snapshot. Each call allocates its own context,
 * so the evaluator is safe for concurrent use.
 */
public class MatcherEvaluator {

    private static final Logger LOG = Logger.getLogger(MatcherEvaluator.class);

    /**
     * Decide a request.
     *
     * @param snapshot the model, rules and role graphs to evaluate against
     * @param request  values bound to the request definition, already checked for arity
     * @return the decision and the rule that produced it
     * @throws EnforcementException if the matcher fails or yields a non-boolean
     */
    public EnforcementResult evaluate(EngineSnapshot snapshot, List<Object> request) {
        final var model = snapshot.model();
        final var context = new RuleContext(snapshot, request);
        final var rules = snapshot.store().rules(PolicyStore.POLICY_SECTION);

        if (rules.isEmpty()) {
            return evaluateWithoutRules(model, context);
        }

        return switch (model.effect()) {
            case ALLOW_OVERRIDE -> allowOverride(model, context, rules);
            case DENY_OVERRIDE -> denyOverride(model, context, rules);
            case ALLOW_BY_DEFAULT -> allowByDefault(model, context, rules);
            case PRIORITY -> firstMatch(model, context, rules);
        };
    }

    // A matcher that never reads p.* can still decide on its own.
    private EnforcementResult evaluateWithoutRules(CompiledModel model, RuleContext context) {
        if (model.matcher().referencesPolicy()) {
            return EnforcementResult.byDefault(model.effect().defaultDecision());
        }
        if (matches(model.matcher(), context)) {
            return EnforcementResult.byDefault(true);
        }
        return EnforcementResult.byDefault(model.effect().defaultDecision());
    }

    private EnforcementResult allowOverride(CompiledModel model, RuleContext context, List<PolicyRule> rules) {
        for (var rule : rules) {
            if (matchesRule(model, context, rule) && effectOf(model, rule) == RuleEffect.ALLOW) {
                return EnforcementResult.allow(rule);
            }
        }
        return EnforcementResult.byDefault(false);
    }

    private EnforcementResult denyOverride(CompiledModel model, RuleContext context, List<PolicyRule> rules) {
        PolicyRule firstAllow = null;
        for (var rule : rules) {
            if (!matchesRule(model, context, rule)) {
                continue;
            }
            if (effectOf(model, rule) == RuleEffect.DENY) {
                return EnforcementResult.deny(rule);
            }
            if (firstAllow == null) {
                firstAllow = rule;
            }
        }
        return firstAllow != null ? EnforcementResult.allow(firstAllow) : EnforcementResult.byDefault(false);
    }

    private EnforcementResult allowByDefault(CompiledModel model, RuleContext context, List<PolicyRule> rules) {
        for (var rule : rules) {
            if (matchesRule(model, context, rule) && effectOf(model, rule) == RuleEffect.DENY) {
                return EnforcementResult.deny(rule);
            }
        }
        return EnforcementResult.byDefault(true);
    }

    private EnforcementResult firstMatch(CompiledModel model, RuleContext context, List<PolicyRule> rules) {
        for (var rule : rules) {
            if (matchesRule(model, context, rule)) {
                return effectOf(model, rule) == RuleEffect.ALLOW
                        ? EnforcementResult.allow(rule)
                        : EnforcementResult.deny(rule);
            }
        }
        return EnforcementResult.byDefault(false);
    }

    private boolean matchesRule(CompiledModel model, RuleContext context, PolicyRule rule) {
        context.bind(rule);
        final var matched = matches(model.matcher(), context);
        if (matched) {
            LOG.debugf("Rule [%s] matched", rule);
        }
        return matched;
    }

    private boolean matches(Expression matcher, EvaluationContext context) {
        final var result = matcher.evaluate(context);
        if (result instanceof Boolean b) {
            return b;
        }
        throw new EnforcementException("Matcher '" + matcher + "' evaluated to "
                + (result == null ? "null" : result.getClass().getSimpleName()) + ", expected a boolean");
    }

    private RuleEffect effectOf(CompiledModel model, PolicyRule rule) {
        final var index = model.effectIndex();
        if (index.isEmpty()) {
            return RuleEffect.ALLOW;
        }
        final var raw = rule.value(index.getAsInt());
        return RuleEffect.parse(raw)
                .orElseThrow(() -> new EnforcementException("Rule [" + rule + "] has invalid effect '" + raw + "'"));
    }

    /**
     * Per-call bindings. The current rule changes as the evaluator walks the store.
     */
    private static final class RuleContext implements EvaluationContext {

        private final EngineSnapshot snapshot;
        private final List<Object> request;
        private PolicyRule current;

        RuleContext(EngineSnapshot snapshot, List<Object> request) {
            this.snapshot = snapshot;
            this.request = request;
        }

        void bind(PolicyRule rule) {
            this.current = rule;
        }

        @Override
        public Object requestValue(int index) {
            return request.get(index);
        }

        @Override
        public Object policyValue(int index) {
            if (current == null) {
                throw new EnforcementException("Matcher reads a policy field but no policy rule is bound");
            }
            return current.value(index);
        }

        @Override
        public MatchingOptions options() {
            return snapshot.model().options();
        }

        @Override
        public boolean hasRoleLink(String roleKey, String subject, String role, String domain) {
            return snapshot.roleGraph(roleKey).hasLink(subject, role, domain);
        }

        @Override
        public Expression compileRule(String ruleText) {
            return snapshot.model().ruleCompiler().compile(ruleText);
        }
    }
}
