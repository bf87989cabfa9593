package bouncer.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

/**
 * Port for managing policy rules and grouping rules.
 *
 * <p>Every mutation is atomic: concurrent decisions observe the rule set
 * either fully before or fully after it. Mutations return false when they
 * change nothing. Invalid rules raise
 * {@link bouncer.core.model.PolicyMutationException} and leave the rule set
 * untouched.
 */
public interface PolicyManagement {

    /**
     * Replace the compiled model.
     *
     * <p>Current rules are re-validated against the new model. If compilation or
     * validation fails the previous model stays active.
     *
     * @param modelText the model description
     */
    void loadModel(String modelText);

    List<List<String>> getPolicy();

    /**
     * @param fieldIndex  first policy field the filter applies to
     * @param fieldValues values to match from that field on; an empty value matches anything
     * @return matching policy rules
     */
    List<List<String>> getFilteredPolicy(int fieldIndex, String... fieldValues);

    boolean hasPolicy(String... values);

    boolean addPolicy(String... values);

    /**
     * Add several policy rules in one atomic step.
     *
     * <p>All rules are validated before any is added.
     *
     * @param rules the rules
     * @return true if at least one rule was new
     */
    boolean addPolicies(List<List<String>> rules);

    boolean removePolicy(String... values);

    boolean removePolicies(List<List<String>> rules);

    boolean removeFilteredPolicy(int fieldIndex, String... fieldValues);

    List<List<String>> getGroupingPolicy();

    List<List<String>> getNamedGroupingPolicy(String roleKey);

    boolean hasGroupingPolicy(String... values);

    boolean addGroupingPolicy(String... values);

    boolean addNamedGroupingPolicy(String roleKey, String... values);

    boolean removeGroupingPolicy(String... values);

    boolean removeNamedGroupingPolicy(String roleKey, String... values);

    List<String> getAllSubjects();

    List<String> getAllObjects();

    List<String> getAllActions();

    List<String> getAllRoles();

    /**
     * Replace all rules with the contents of the policy repository.
     *
     * @return Uni with the number of rules loaded
     */
    Uni<Integer> loadPolicy();

    /**
     * Write all current rules to the policy repository.
     *
     * @return Uni with the number of rules saved
     */
    Uni<Integer> savePolicy();
}
