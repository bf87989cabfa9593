package bouncer.core.service.evaluation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import bouncer.core.model.definition.CompiledModel;
import bouncer.core.model.definition.RoleDefinition;
import bouncer.core.model.policy.PolicyRule;
import bouncer.core.model.policy.RoleLink;
import bouncer.core.service.policy.PolicyStore;
import bouncer.core.service.role.RoleGraph;

/**
 * Everything an enforcement call reads, captured as one immutable value.
 *
 * <p>Readers grab the current snapshot once and evaluate against it, so a
 * concurrent mutation is either fully visible or not visible at all.
 *
 * @param model      the compiled model
 * @param store      the policy and role-assignment rules
 * @param roleGraphs one role graph per role definition key
 */
public record EngineSnapshot(CompiledModel model, PolicyStore store, Map<String, RoleGraph> roleGraphs) {

    public EngineSnapshot {
        roleGraphs = Collections.unmodifiableMap(new LinkedHashMap<>(roleGraphs));
    }

    /**
     * Build a snapshot whose role graphs are derived from the store's grouping sections.
     *
     * @param model the compiled model
     * @param store rules already validated against {@code model}
     * @return the snapshot
     */
    public static EngineSnapshot of(CompiledModel model, PolicyStore store) {
        final Map<String, RoleGraph> graphs = new LinkedHashMap<>();
        for (var role : model.roles().values()) {
            final List<RoleLink> links = new ArrayList<>();
            for (var rule : store.rules(role.key())) {
                links.add(toLink(role, rule));
            }
            graphs.put(role.key(), RoleGraph.of(links));
        }
        return new EngineSnapshot(model, store, graphs);
    }

    /**
     * Convert a grouping rule into the edge it represents.
     *
     * @param role the role definition the rule belongs to
     * @param rule a rule of that definition's section
     * @return the role link
     */
    public static RoleLink toLink(RoleDefinition role, PolicyRule rule) {
        return new RoleLink(rule.value(0), rule.value(1), role.hasDomain() ? rule.value(2) : RoleLink.NO_DOMAIN);
    }

    public RoleGraph roleGraph(String key) {
        return roleGraphs.getOrDefault(key, RoleGraph.empty());
    }

    /**
     * Derive the snapshot that results from a rule change.
     *
     * <p>Only role graphs whose section appears in the change are rebuilt, and
     * each by applying the changed links to the existing graph.
     *
     * @param store   the store after the change
     * @param added   rules that were newly added
     * @param removed rules that were actually removed
     * @return a snapshot sharing the model and untouched graphs with this one
     */
    public EngineSnapshot withChanges(PolicyStore store, Collection<PolicyRule> added, Collection<PolicyRule> removed) {
        final Map<String, RoleGraph> graphs = new LinkedHashMap<>(roleGraphs);
        for (var rule : removed) {
            model.role(rule.section()).ifPresent(role ->
                    graphs.compute(role.key(), (key, graph) -> graph(graph).withoutLink(toLink(role, rule))));
        }
        for (var rule : added) {
            model.role(rule.section()).ifPresent(role ->
                    graphs.compute(role.key(), (key, graph) -> graph(graph).withLink(toLink(role, rule))));
        }
        return new EngineSnapshot(model, store, graphs);
    }

    private static RoleGraph graph(RoleGraph graph) {
        return graph == null ? RoleGraph.empty() : graph;
    }
}
