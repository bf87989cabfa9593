package bouncer.core.model.policy;

import java.util.Arrays;
import java.util.List;

/**
 * A stored policy or role-assignment line.
 *
 * <p>Rules are immutable and compared by section plus the full value tuple.
 * A mutation never edits a rule in place; it replaces it.
 *
 * @param section the section key the rule belongs to (e.g., "p", "g", "g2")
 * @param values  the ordered field values, matching the section's arity
 */
public record PolicyRule(String section, List<String> values) {

    public PolicyRule {
        if (section == null || section.isBlank()) {
            throw new IllegalArgumentException("Policy section cannot be null or blank");
        }
        if (values == null) {
            throw new IllegalArgumentException("Policy values cannot be null");
        }
        values = List.copyOf(values);
    }

    /**
     * Create a rule from a section key and values.
     *
     * @param section the section key
     * @param values  the field values
     * @return a new PolicyRule
     */
    public static PolicyRule of(String section, String... values) {
        return new PolicyRule(section, Arrays.asList(values));
    }

    /**
     * @return the number of field values
     */
    public int arity() {
        return values.size();
    }

    /**
     * Get a field value by position.
     *
     * @param index zero-based field index
     * @return the value
     */
    public String value(int index) {
        return values.get(index);
    }

    /**
     * Check whether the rule's values start with the given prefix.
     *
     * <p>An empty prefix value acts as a wildcard for that position.
     *
     * @param fieldIndex the first field to compare
     * @param prefix     the values to compare against
     * @return true if every non-empty prefix value equals the rule value at that position
     */
    public boolean matchesFilter(int fieldIndex, List<String> prefix) {
        if (fieldIndex < 0 || fieldIndex + prefix.size() > values.size()) {
            return false;
        }
        for (var i = 0; i < prefix.size(); i++) {
            final var expected = prefix.get(i);
            if (expected != null && !expected.isEmpty() && !expected.equals(values.get(fieldIndex + i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return PolicyLineFormat.format(this);
    }
}
