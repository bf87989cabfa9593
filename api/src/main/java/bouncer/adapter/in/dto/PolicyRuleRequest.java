package bouncer.adapter.in.dto;

import java.util.List;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import bouncer.core.model.definition.CompiledModel;

/**
 * Request body naming one rule.
 *
 * @param section the section key; defaults to the policy section {@code p}
 * @param values  the rule's values, in field order
 */
public record PolicyRuleRequest(String section, @NotNull @NotEmpty List<@NotNull String> values) {

    public String sectionOrDefault() {
        return section == null || section.isBlank() ? CompiledModel.POLICY_KEY : section;
    }
}
