package bouncer.core.service.policy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

import bouncer.core.model.policy.PolicyRule;

/**
 * Immutable set of policy and role-assignment rules, grouped by section.
 *
 * <p>Rules are deduplicated by full value equality. Within a section they keep
 * insertion order, except for the policy section when the model declares a
 * {@code priority} field: those rules stay sorted by ascending priority, ties
 * broken by insertion order.
 *
 * <p>Mutators return a new store, or this store when nothing changed, so
 * callers detect no-ops by identity. Only the affected section is copied.
 * Rules are expected to be validated against the model before they get here.
 */
public final class PolicyStore {

    public static final String POLICY_SECTION = "p";

    private final Map<String, Section> sections;
    private final OptionalInt priorityIndex;

    private PolicyStore(Map<String, Section> sections, OptionalInt priorityIndex) {
        this.sections = sections;
        this.priorityIndex = priorityIndex;
    }

    /**
     * @param priorityIndex position of the priority field in policy rules, if the model declares one
     * @return an empty store
     */
    public static PolicyStore empty(OptionalInt priorityIndex) {
        return new PolicyStore(Map.of(), priorityIndex);
    }

    /**
     * Build a store from a full rule set in one pass.
     *
     * @param rules         the rules, in load order
     * @param priorityIndex position of the priority field, if any
     * @return the store
     */
    public static PolicyStore of(Collection<PolicyRule> rules, OptionalInt priorityIndex) {
        final Map<String, List<PolicyRule>> ordered = new LinkedHashMap<>();
        final Map<String, Set<List<String>>> keys = new HashMap<>();
        for (var rule : rules) {
            if (keys.computeIfAbsent(rule.section(), s -> new HashSet<>()).add(rule.values())) {
                ordered.computeIfAbsent(rule.section(), s -> new ArrayList<>()).add(rule);
            }
        }

        final var store = new PolicyStore(Map.of(), priorityIndex);
        final Map<String, Section> sections = new LinkedHashMap<>();
        ordered.forEach((section, list) -> {
            if (store.isPrioritized(section)) {
                list.sort(Comparator.comparingInt(store::priorityOf));
            }
            sections.put(
                    section,
                    new Section(Collections.unmodifiableList(list), Collections.unmodifiableSet(keys.get(section))));
        });
        return new PolicyStore(Collections.unmodifiableMap(sections), priorityIndex);
    }

    public boolean contains(PolicyRule rule) {
        final var section = sections.get(rule.section());
        return section != null && section.keys().contains(rule.values());
    }

    /**
     * @param rule the rule to add
     * @return a store containing the rule, or this store if it was already present
     */
    public PolicyStore withRule(PolicyRule rule) {
        if (contains(rule)) {
            return this;
        }
        final var current = sections.getOrDefault(rule.section(), Section.EMPTY);
        final List<PolicyRule> list = new ArrayList<>(current.rules().size() + 1);
        list.addAll(current.rules());
        list.add(insertionPoint(rule, current.rules()), rule);

        final Set<List<String>> keys = new HashSet<>(current.keys());
        keys.add(rule.values());
        return replace(rule.section(), new Section(Collections.unmodifiableList(list), Collections.unmodifiableSet(keys)));
    }

    /**
     * Add several rules at once.
     *
     * @param rules the rules to add
     * @return the resulting store, or this store if every rule was already present
     */
    public PolicyStore withRules(Collection<PolicyRule> rules) {
        var result = this;
        for (var rule : rules) {
            result = result.withRule(rule);
        }
        return result;
    }

    /**
     * @param rule the rule to remove
     * @return a store without the rule, or this store if it was absent
     */
    public PolicyStore withoutRule(PolicyRule rule) {
        return withoutRules(List.of(rule));
    }

    /**
     * Remove several rules at once.
     *
     * @param rules the rules to remove
     * @return the resulting store, or this store if none was present
     */
    public PolicyStore withoutRules(Collection<PolicyRule> rules) {
        final Map<String, Set<List<String>>> bySection = new HashMap<>();
        for (var rule : rules) {
            if (contains(rule)) {
                bySection.computeIfAbsent(rule.section(), s -> new HashSet<>()).add(rule.values());
            }
        }
        if (bySection.isEmpty()) {
            return this;
        }

        final Map<String, Section> copy = new LinkedHashMap<>(sections);
        bySection.forEach((name, removed) -> {
            final var current = sections.get(name);
            final var list = current.rules().stream()
                    .filter(r -> !removed.contains(r.values()))
                    .toList();
            if (list.isEmpty()) {
                copy.remove(name);
            } else {
                final Set<List<String>> keys = new HashSet<>(current.keys());
                keys.removeAll(removed);
                copy.put(name, new Section(list, Collections.unmodifiableSet(keys)));
            }
        });
        return new PolicyStore(Collections.unmodifiableMap(copy), priorityIndex);
    }

    /**
     * @param section the section key
     * @return the section's rules in evaluation order
     */
    public List<PolicyRule> rules(String section) {
        return sections.getOrDefault(section, Section.EMPTY).rules();
    }

    /**
     * Lazy view of a section's rules whose leading values match {@code prefix}.
     *
     * <p>The returned iterable reads this immutable store, so it can be iterated
     * any number of times and never observes later mutations. An empty prefix
     * value matches anything at that position.
     *
     * @param section the section key
     * @param prefix  leading values to match
     * @return the matching rules
     */
    public Iterable<PolicyRule> allRules(String section, String... prefix) {
        final var rules = rules(section);
        final var filter = Arrays.asList(prefix);
        return () -> rules.stream().filter(rule -> rule.matchesFilter(0, filter)).iterator();
    }

    /**
     * @return every rule, section by section
     */
    public List<PolicyRule> allRules() {
        final List<PolicyRule> all = new ArrayList<>(size());
        sections.values().forEach(section -> all.addAll(section.rules()));
        return all;
    }

    public Set<String> sections() {
        return sections.keySet();
    }

    public int size() {
        return sections.values().stream().mapToInt(s -> s.rules().size()).sum();
    }

    public boolean isEmpty() {
        return sections.isEmpty();
    }

    private PolicyStore replace(String name, Section section) {
        final Map<String, Section> copy = new LinkedHashMap<>(sections);
        copy.put(name, section);
        return new PolicyStore(Collections.unmodifiableMap(copy), priorityIndex);
    }

    private int insertionPoint(PolicyRule rule, List<PolicyRule> existing) {
        if (!isPrioritized(rule.section())) {
            return existing.size();
        }
        // Upper bound: after every rule with the same or a lower priority.
        final var priority = priorityOf(rule);
        var low = 0;
        var high = existing.size();
        while (low < high) {
            final var mid = (low + high) >>> 1;
            if (priorityOf(existing.get(mid)) <= priority) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private boolean isPrioritized(String section) {
        return priorityIndex.isPresent() && POLICY_SECTION.equals(section);
    }

    private int priorityOf(PolicyRule rule) {
        return Integer.parseInt(rule.value(priorityIndex.getAsInt()).trim());
    }

    private record Section(List<PolicyRule> rules, Set<List<String>> keys) {
        static final Section EMPTY = new Section(List.of(), Set.of());
    }
}
