package bouncer.core.model.policy;

import java.util.Optional;

/**
 * Outcome of a single enforcement call.
 *
 * @param allowed     the decision
 * @param explanation the policy rule that determined the decision, if one did
 */
public record EnforcementResult(boolean allowed, Optional<PolicyRule> explanation) {

    public EnforcementResult {
        if (explanation == null) {
            explanation = Optional.empty();
        }
    }

    public static EnforcementResult allow(PolicyRule rule) {
        return new EnforcementResult(true, Optional.ofNullable(rule));
    }

    public static EnforcementResult deny(PolicyRule rule) {
        return new EnforcementResult(false, Optional.ofNullable(rule));
    }

    public static EnforcementResult byDefault(boolean allowed) {
        return new EnforcementResult(allowed, Optional.empty());
    }
}
