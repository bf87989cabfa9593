package bouncer.adapter.in.dto;

import bouncer.core.model.policy.EnforcementResult;

/**
 * DTO for a decision and the rule that produced it.
 *
 * @param allowed the decision
 * @param rule    the deciding rule, or null when no rule decided
 */
public record DecisionDto(boolean allowed, PolicyRuleDto rule) {

    public static DecisionDto fromModel(EnforcementResult result) {
        return new DecisionDto(
                result.allowed(), result.explanation().map(PolicyRuleDto::fromModel).orElse(null));
    }
}
