package bouncer.adapter.in.dto;

import java.util.List;

import bouncer.core.model.policy.PolicyRule;

/**
 * DTO for a stored rule.
 */
public record PolicyRuleDto(String section, List<String> values) {

    public static PolicyRuleDto fromModel(PolicyRule rule) {
        return new PolicyRuleDto(rule.section(), rule.values());
    }
}
