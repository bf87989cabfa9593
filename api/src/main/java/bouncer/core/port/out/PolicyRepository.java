package bouncer.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import bouncer.core.model.policy.PolicyRule;

/**
 * Port interface for persistent storage of policy and grouping rules.
 *
 * <p>Implementations may use any backing store that can hold the line-oriented
 * rule format: a file, a database table, an object store, and so on.
 * Failures surface as failed Unis; callers decide whether the change is
 * applied.
 */
public interface PolicyRepository {

    /**
     * Read every stored rule, in storage order.
     *
     * @return Uni with the rules
     */
    Uni<List<PolicyRule>> loadPolicy();

    /**
     * Replace the stored rules.
     *
     * @param rules the complete rule set
     * @return Uni completing when the rules are durable
     */
    Uni<Void> savePolicy(List<PolicyRule> rules);

    /**
     * Store additional rules.
     *
     * @param rules rules that were not present before
     * @return Uni completing when the rules are durable
     */
    Uni<Void> addPolicies(List<PolicyRule> rules);

    /**
     * Delete stored rules.
     *
     * @param rules rules that were present before
     * @return Uni completing when the rules are gone
     */
    Uni<Void> removePolicies(List<PolicyRule> rules);

    default Uni<Void> addPolicy(PolicyRule rule) {
        return addPolicies(List.of(rule));
    }

    default Uni<Void> removePolicy(PolicyRule rule) {
        return removePolicies(List.of(rule));
    }
}
