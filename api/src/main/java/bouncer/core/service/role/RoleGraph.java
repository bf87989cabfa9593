package bouncer.core.service.role;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import bouncer.core.model.policy.RoleLink;

/**
 * Immutable has-role / inherits-role graph.
 *
 * <p>Nodes are subject and role names, partitioned by domain: a link added
 * under one domain is invisible to queries under another. Links without a
 * domain live in {@link RoleLink#NO_DOMAIN}.
 *
 * <p>Mutators return a new graph and leave this one untouched, so a graph can
 * be shared freely between threads. Only the adjacency of the affected domain
 * is copied.
 *
 * <p>Reachability uses a breadth-first walk with a visited set. Cycles are
 * treated as mutual reachability and always terminate.
 */
public final class RoleGraph {

    private static final RoleGraph EMPTY = new RoleGraph(Map.of(), 0);

    private final Map<String, DomainLinks> domains;
    private final int linkCount;

    private RoleGraph(Map<String, DomainLinks> domains, int linkCount) {
        this.domains = domains;
        this.linkCount = linkCount;
    }

    public static RoleGraph empty() {
        return EMPTY;
    }

    /**
     * Build a graph from a batch of links in one pass.
     *
     * @param links the links
     * @return the graph
     */
    public static RoleGraph of(Collection<RoleLink> links) {
        final Map<String, Map<String, Set<String>>> parents = new HashMap<>();
        final Map<String, Map<String, Set<String>>> children = new HashMap<>();
        var count = 0;
        for (var link : links) {
            final var added = parents.computeIfAbsent(link.domain(), d -> new HashMap<>())
                    .computeIfAbsent(link.child(), c -> new LinkedHashSet<>())
                    .add(link.parent());
            if (added) {
                children.computeIfAbsent(link.domain(), d -> new HashMap<>())
                        .computeIfAbsent(link.parent(), p -> new LinkedHashSet<>())
                        .add(link.child());
                count++;
            }
        }

        final Map<String, DomainLinks> domains = new HashMap<>();
        for (var entry : parents.entrySet()) {
            domains.put(
                    entry.getKey(),
                    new DomainLinks(freeze(entry.getValue()), freeze(children.get(entry.getKey()))));
        }
        return new RoleGraph(Collections.unmodifiableMap(domains), count);
    }

    /**
     * @param link the link to add
     * @return a graph containing the link, or this graph if it already does
     */
    public RoleGraph withLink(RoleLink link) {
        final var current = domains.getOrDefault(link.domain(), DomainLinks.EMPTY);
        if (current.parentsOf(link.child()).contains(link.parent())) {
            return this;
        }
        return replaceDomain(link.domain(), current.with(link.child(), link.parent()), linkCount + 1);
    }

    /**
     * @param link the link to remove
     * @return a graph without the link, or this graph if it was absent
     */
    public RoleGraph withoutLink(RoleLink link) {
        final var current = domains.get(link.domain());
        if (current == null || !current.parentsOf(link.child()).contains(link.parent())) {
            return this;
        }
        return replaceDomain(link.domain(), current.without(link.child(), link.parent()), linkCount - 1);
    }

    /**
     * Test whether {@code subject} reaches {@code role}, directly or transitively.
     *
     * <p>A name always reaches itself.
     *
     * @param subject the subject or role name
     * @param role    the role name
     * @param domain  the domain to query
     * @return true if reachable
     */
    public boolean hasLink(String subject, String role, String domain) {
        if (subject.equals(role)) {
            return true;
        }
        final var links = domains.get(normalize(domain));
        if (links == null) {
            return false;
        }

        final Set<String> visited = new LinkedHashSet<>();
        final var queue = new ArrayDeque<String>();
        queue.add(subject);
        visited.add(subject);
        while (!queue.isEmpty()) {
            for (var parent : links.parentsOf(queue.poll())) {
                if (parent.equals(role)) {
                    return true;
                }
                if (visited.add(parent)) {
                    queue.add(parent);
                }
            }
        }
        return false;
    }

    /**
     * @return every role {@code subject} reaches, excluding itself
     */
    public Set<String> rolesOf(String subject, String domain) {
        final var links = domains.get(normalize(domain));
        return links == null ? Set.of() : walk(subject, links.parents());
    }

    /**
     * @return every subject or role that reaches {@code role}, excluding itself
     */
    public Set<String> usersOf(String role, String domain) {
        final var links = domains.get(normalize(domain));
        return links == null ? Set.of() : walk(role, links.children());
    }

    public Set<String> directRolesOf(String subject, String domain) {
        final var links = domains.get(normalize(domain));
        return links == null ? Set.of() : links.parentsOf(subject);
    }

    public Set<String> directUsersOf(String role, String domain) {
        final var links = domains.get(normalize(domain));
        return links == null ? Set.of() : links.childrenOf(role);
    }

    public Set<String> domains() {
        return domains.keySet();
    }

    /**
     * @return all links, grouped by domain
     */
    public List<RoleLink> links() {
        final List<RoleLink> result = new ArrayList<>(linkCount);
        domains.forEach((domain, links) -> links.parents()
                .forEach((child, parents) -> parents.forEach(parent -> result.add(new RoleLink(child, parent, domain)))));
        return result;
    }

    public int size() {
        return linkCount;
    }

    private RoleGraph replaceDomain(String domain, DomainLinks links, int newCount) {
        final Map<String, DomainLinks> copy = new HashMap<>(domains);
        if (links.isEmpty()) {
            copy.remove(domain);
        } else {
            copy.put(domain, links);
        }
        return new RoleGraph(Collections.unmodifiableMap(copy), newCount);
    }

    private static Set<String> walk(String start, Map<String, Set<String>> edges) {
        final Set<String> reached = new LinkedHashSet<>();
        final var queue = new ArrayDeque<String>();
        queue.add(start);
        while (!queue.isEmpty()) {
            for (var next : edges.getOrDefault(queue.poll(), Set.of())) {
                if (!next.equals(start) && reached.add(next)) {
                    queue.add(next);
                }
            }
        }
        return Collections.unmodifiableSet(reached);
    }

    private static String normalize(String domain) {
        return domain == null ? RoleLink.NO_DOMAIN : domain;
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> source) {
        final Map<String, Set<String>> frozen = new HashMap<>();
        source.forEach((key, value) -> frozen.put(key, Collections.unmodifiableSet(value)));
        return Collections.unmodifiableMap(frozen);
    }

    /**
     * Adjacency of one domain in both directions.
     */
    private record DomainLinks(Map<String, Set<String>> parents, Map<String, Set<String>> children) {

        static final DomainLinks EMPTY = new DomainLinks(Map.of(), Map.of());

        Set<String> parentsOf(String child) {
            return parents.getOrDefault(child, Set.of());
        }

        Set<String> childrenOf(String parent) {
            return children.getOrDefault(parent, Set.of());
        }

        boolean isEmpty() {
            return parents.isEmpty();
        }

        DomainLinks with(String child, String parent) {
            return new DomainLinks(append(parents, child, parent), append(children, parent, child));
        }

        DomainLinks without(String child, String parent) {
            return new DomainLinks(drop(parents, child, parent), drop(children, parent, child));
        }

        private static Map<String, Set<String>> append(Map<String, Set<String>> edges, String from, String to) {
            final Map<String, Set<String>> copy = new HashMap<>(edges);
            final Set<String> targets = new LinkedHashSet<>(edges.getOrDefault(from, Set.of()));
            targets.add(to);
            copy.put(from, Collections.unmodifiableSet(targets));
            return Collections.unmodifiableMap(copy);
        }

        private static Map<String, Set<String>> drop(Map<String, Set<String>> edges, String from, String to) {
            final Map<String, Set<String>> copy = new HashMap<>(edges);
            final Set<String> targets = new LinkedHashSet<>(edges.getOrDefault(from, Set.of()));
            targets.remove(to);
            if (targets.isEmpty()) {
                copy.remove(from);
            } else {
                copy.put(from, Collections.unmodifiableSet(targets));
            }
            return Collections.unmodifiableMap(copy);
        }
    }
}
