package bouncer.core.service.enforcer;

import java.util.Arrays;
import java.util.List;

import bouncer.core.model.PolicyMutationException;
import bouncer.core.model.definition.CompiledModel;
import bouncer.core.model.policy.PolicyLineFormat;
import bouncer.core.model.policy.PolicyRule;
import bouncer.core.model.policy.RuleEffect;

/**
 * Checks rules against a compiled model before they reach the store.
 */
final class PolicyRuleValidator {

    private PolicyRuleValidator() {}

    /**
     * Build a rule from raw values, rejecting nulls.
     */
    static PolicyRule rule(String section, String... values) {
        if (values == null) {
            throw new PolicyMutationException("Rule values cannot be null");
        }
        return rule(section, Arrays.asList(values));
    }

    static PolicyRule rule(String section, List<String> values) {
        if (values == null || values.stream().anyMatch(v -> v == null)) {
            throw new PolicyMutationException("Rule values cannot be null: " + values);
        }
        try {
            return new PolicyRule(section, values);
        } catch (IllegalArgumentException e) {
            throw new PolicyMutationException(e.getMessage(), e);
        }
    }

    /**
     * @throws PolicyMutationException if the section is unknown, the arity is wrong, a value
     *                                 spans several lines, a role link names an empty subject
     *                                 or role, or the effect or priority field is invalid
     */
    static void validate(CompiledModel model, PolicyRule rule) {
        if (!rule.values().stream().allMatch(PolicyLineFormat::isSingleLine)) {
            throw new PolicyMutationException("Rule [" + rule + "] has a value containing a line break");
        }
        if (!model.acceptsSection(rule.section())) {
            throw new PolicyMutationException("Section '" + rule.section() + "' is not defined by the model: " + rule);
        }
        final var expected = model.arityOf(rule.section());
        if (rule.arity() != expected) {
            throw new PolicyMutationException("Rule [" + rule + "] has " + rule.arity() + " value(s), section '"
                    + rule.section() + "' expects " + expected);
        }
        if (model.role(rule.section()).isPresent()) {
            if (rule.value(0).isEmpty() || rule.value(1).isEmpty()) {
                throw new PolicyMutationException("Role rule [" + rule + "] needs a non-empty subject and role");
            }
            return;
        }
        if (!CompiledModel.POLICY_KEY.equals(rule.section())) {
            return;
        }

        final var effectIndex = model.effectIndex();
        if (effectIndex.isPresent()) {
            final var raw = rule.value(effectIndex.getAsInt());
            if (RuleEffect.parse(raw).isEmpty()) {
                throw new PolicyMutationException("Rule [" + rule + "] has invalid effect '" + raw
                        + "', expected allow or deny");
            }
        }

        final var priorityIndex = model.priorityIndex();
        if (priorityIndex.isPresent()) {
            final var raw = rule.value(priorityIndex.getAsInt());
            try {
                Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                throw new PolicyMutationException("Rule [" + rule + "] has non-integer priority '" + raw + "'", e);
            }
        }
    }
}
