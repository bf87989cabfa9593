package bouncer.core.service.enforcer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import bouncer.core.model.EnforcementException;
import bouncer.core.model.PolicyEngineException;
import bouncer.core.model.PolicyMutationException;
import bouncer.core.model.definition.CompiledModel;
import bouncer.core.model.policy.EnforcementResult;
import bouncer.core.model.policy.PolicyRule;
import bouncer.core.model.policy.RoleLink;
import bouncer.core.port.in.AccessEnforcement;
import bouncer.core.port.in.PolicyManagement;
import bouncer.core.port.in.RoleManagement;
import bouncer.core.port.out.PolicyRepository;
import bouncer.core.service.compiler.ModelCompiler;
import bouncer.core.service.evaluation.EngineSnapshot;
import bouncer.core.service.evaluation.MatcherEvaluator;
import bouncer.core.service.policy.PolicyStore;
import bouncer.core.service.role.RoleGraph;

/**
 * Entry point of the decision engine.
 *
 * <p>The enforcer owns one {@link EngineSnapshot} holding the compiled model,
 * the rules and the role graphs. Decisions read the snapshot through a single
 * volatile reference and never lock. Mutations are serialized by a lock, build
 * a new snapshot from the current one, and publish it with one write, so a
 * concurrent decision sees either the old state or the new state in full.
 *
 * <p>With auto-save enabled, a mutation is written to the
 * {@link PolicyRepository} before it is published. If the write fails the
 * mutation is rejected and the in-memory state does not change.
 */
public class Enforcer implements AccessEnforcement, PolicyManagement, RoleManagement {

    private static final Logger LOG = Logger.getLogger(Enforcer.class);

    public static final String DEFAULT_ROLE_KEY = "g";
    public static final Duration DEFAULT_STORAGE_TIMEOUT = Duration.ofSeconds(30);

    private static final String SUBJECT_FIELD = "sub";
    private static final String OBJECT_FIELD = "obj";
    private static final String ACTION_FIELD = "act";

    private final ModelCompiler compiler;
    private final PolicyRepository repository;
    private final boolean autoSave;
    private final Duration storageTimeout;
    private final MatcherEvaluator evaluator = new MatcherEvaluator();
    private final ReentrantLock mutationLock = new ReentrantLock();

    private volatile EngineSnapshot snapshot;

    public Enforcer(ModelCompiler compiler, String modelText, PolicyRepository repository) {
        this(compiler, modelText, repository, false, DEFAULT_STORAGE_TIMEOUT);
    }

    /**
     * @param compiler       compiles model text, carrying matching options and custom functions
     * @param modelText      the initial model
     * @param repository     backing storage for load, save and auto-save
     * @param autoSave       whether mutations are written through to the repository
     * @param storageTimeout how long a mutation waits for an auto-save write
     * @throws bouncer.core.model.ModelCompileException if the model does not compile
     */
    public Enforcer(
            ModelCompiler compiler,
            String modelText,
            PolicyRepository repository,
            boolean autoSave,
            Duration storageTimeout) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.autoSave = autoSave;
        this.storageTimeout = storageTimeout;

        final var model = compiler.compile(modelText);
        this.snapshot = EngineSnapshot.of(model, PolicyStore.empty(model.priorityIndex()));
    }

    public CompiledModel model() {
        return snapshot.model();
    }

    EngineSnapshot snapshot() {
        return snapshot;
    }

    // -------------------------------------------------------------------------
    // Decisions
    // -------------------------------------------------------------------------

    @Override
    public boolean enforce(Object... requestValues) {
        return enforceWithExplanation(requestValues).allowed();
    }

    @Override
    public EnforcementResult enforceWithExplanation(Object... requestValues) {
        final var current = snapshot;
        final var request = current.model().request();
        if (requestValues == null) {
            throw new EnforcementException("Request values cannot be null");
        }
        if (requestValues.length != request.arity()) {
            throw new EnforcementException("Request has " + requestValues.length + " value(s), expected "
                    + request.arity() + " (" + String.join(", ", request.fields()) + ")");
        }
        for (var i = 0; i < requestValues.length; i++) {
            if (requestValues[i] == null) {
                throw new EnforcementException("Request field '" + request.fields().get(i) + "' is null");
            }
        }

        final var result = evaluator.evaluate(current, List.of(requestValues));
        LOG.debugf("Decision %s for %s", result.allowed() ? "allow" : "deny", List.of(requestValues));
        return result;
    }

    // -------------------------------------------------------------------------
    // Model
    // -------------------------------------------------------------------------

    @Override
    public void loadModel(String modelText) {
        final var model = compiler.compile(modelText);
        mutationLock.lock();
        try {
            final var rules = snapshot.store().allRules();
            rules.forEach(rule -> PolicyRuleValidator.validate(model, rule));
            snapshot = EngineSnapshot.of(model, PolicyStore.of(rules, model.priorityIndex()));
            LOG.infof("Model reloaded, %d rule(s) carried over", rules.size());
        } finally {
            mutationLock.unlock();
        }
    }

    // -------------------------------------------------------------------------
    // Policy management
    // -------------------------------------------------------------------------

    @Override
    public List<List<String>> getPolicy() {
        return values(snapshot.store().rules(PolicyStore.POLICY_SECTION));
    }

    @Override
    public List<List<String>> getFilteredPolicy(int fieldIndex, String... fieldValues) {
        return values(filtered(snapshot.store(), PolicyStore.POLICY_SECTION, fieldIndex, fieldValues));
    }

    @Override
    public boolean hasPolicy(String... values) {
        return snapshot.store().contains(PolicyRuleValidator.rule(PolicyStore.POLICY_SECTION, values));
    }

    @Override
    public boolean addPolicy(String... values) {
        return addRules(List.of(PolicyRuleValidator.rule(PolicyStore.POLICY_SECTION, values)));
    }

    @Override
    public boolean addPolicies(List<List<String>> rules) {
        return addRules(toRules(PolicyStore.POLICY_SECTION, rules));
    }

    @Override
    public boolean removePolicy(String... values) {
        return removeRules(List.of(PolicyRuleValidator.rule(PolicyStore.POLICY_SECTION, values)));
    }

    @Override
    public boolean removePolicies(List<List<String>> rules) {
        return removeRules(toRules(PolicyStore.POLICY_SECTION, rules));
    }

    @Override
    public boolean removeFilteredPolicy(int fieldIndex, String... fieldValues) {
        return removeMatching(() -> filtered(snapshot.store(), PolicyStore.POLICY_SECTION, fieldIndex, fieldValues));
    }

    @Override
    public List<List<String>> getGroupingPolicy() {
        return getNamedGroupingPolicy(DEFAULT_ROLE_KEY);
    }

    @Override
    public List<List<String>> getNamedGroupingPolicy(String roleKey) {
        return values(snapshot.store().rules(roleKey));
    }

    @Override
    public boolean hasGroupingPolicy(String... values) {
        return snapshot.store().contains(PolicyRuleValidator.rule(DEFAULT_ROLE_KEY, values));
    }

    @Override
    public boolean addGroupingPolicy(String... values) {
        return addNamedGroupingPolicy(DEFAULT_ROLE_KEY, values);
    }

    @Override
    public boolean addNamedGroupingPolicy(String roleKey, String... values) {
        return addRules(List.of(PolicyRuleValidator.rule(roleKey, values)));
    }

    @Override
    public boolean removeGroupingPolicy(String... values) {
        return removeNamedGroupingPolicy(DEFAULT_ROLE_KEY, values);
    }

    @Override
    public boolean removeNamedGroupingPolicy(String roleKey, String... values) {
        return removeRules(List.of(PolicyRuleValidator.rule(roleKey, values)));
    }

    @Override
    public List<String> getAllSubjects() {
        return distinctPolicyField(SUBJECT_FIELD, 0);
    }

    @Override
    public List<String> getAllObjects() {
        return distinctPolicyField(OBJECT_FIELD, 1);
    }

    @Override
    public List<String> getAllActions() {
        return distinctPolicyField(ACTION_FIELD, 2);
    }

    @Override
    public List<String> getAllRoles() {
        final Set<String> roles = new LinkedHashSet<>();
        snapshot.store().rules(DEFAULT_ROLE_KEY).forEach(rule -> roles.add(rule.value(1)));
        return List.copyOf(roles);
    }

    @Override
    public Uni<Integer> loadPolicy() {
        return repository
                .loadPolicy()
                .onFailure(e -> !(e instanceof PolicyEngineException))
                .transform(e -> new PolicyMutationException("Failed to read policy: " + e.getMessage(), e))
                .map(rules -> loadPolicy(rules));
    }

    /**
     * Replace every rule in one atomic step.
     *
     * @param rules the complete rule set
     * @return the number of distinct rules now held
     * @throws PolicyMutationException if any rule is invalid; the current rules stay active
     */
    public int loadPolicy(Collection<PolicyRule> rules) {
        mutationLock.lock();
        try {
            final var model = snapshot.model();
            rules.forEach(rule -> PolicyRuleValidator.validate(model, rule));
            final var store = PolicyStore.of(rules, model.priorityIndex());
            snapshot = EngineSnapshot.of(model, store);
            LOG.infof("Loaded %d rule(s) across section(s) %s", store.size(), store.sections());
            return store.size();
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Write every rule to the repository.
     *
     * <p>The rules are read and written under the mutation lock when the returned
     * {@code Uni} is subscribed, so no mutation can land between the read and the
     * write. The write runs on the worker pool.
     */
    @Override
    public Uni<Integer> savePolicy() {
        return Uni.createFrom()
                .item(this::saveUnderLock)
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    private int saveUnderLock() {
        mutationLock.lock();
        try {
            final var rules = snapshot.store().allRules();
            persist(repository.savePolicy(rules), "Failed to save policy");
            LOG.infof("Saved %d rule(s)", rules.size());
            return rules.size();
        } finally {
            mutationLock.unlock();
        }
    }

    // -------------------------------------------------------------------------
    // Role management
    // -------------------------------------------------------------------------

    @Override
    public boolean addRoleForSubject(String subject, String role) {
        return addGroupingPolicy(subject, role);
    }

    @Override
    public boolean addRoleForSubject(String subject, String role, String domain) {
        return addGroupingPolicy(subject, role, domain);
    }

    @Override
    public boolean deleteRoleForSubject(String subject, String role) {
        return removeGroupingPolicy(subject, role);
    }

    @Override
    public boolean deleteRoleForSubject(String subject, String role, String domain) {
        return removeGroupingPolicy(subject, role, domain);
    }

    @Override
    public List<String> getRolesForSubject(String subject) {
        return getRolesForSubject(subject, RoleLink.NO_DOMAIN);
    }

    @Override
    public List<String> getRolesForSubject(String subject, String domain) {
        return List.copyOf(defaultGraph().directRolesOf(subject, domain));
    }

    @Override
    public List<String> getImplicitRolesForSubject(String subject) {
        return getImplicitRolesForSubject(subject, RoleLink.NO_DOMAIN);
    }

    @Override
    public List<String> getImplicitRolesForSubject(String subject, String domain) {
        return List.copyOf(defaultGraph().rolesOf(subject, domain));
    }

    @Override
    public List<String> getUsersForRole(String role) {
        return getUsersForRole(role, RoleLink.NO_DOMAIN);
    }

    @Override
    public List<String> getUsersForRole(String role, String domain) {
        return List.copyOf(defaultGraph().directUsersOf(role, domain));
    }

    @Override
    public boolean hasRoleForSubject(String subject, String role) {
        return hasRoleForSubject(subject, role, RoleLink.NO_DOMAIN);
    }

    @Override
    public boolean hasRoleForSubject(String subject, String role, String domain) {
        return defaultGraph().rolesOf(subject, domain).contains(role);
    }

    @Override
    public boolean deleteSubject(String subject) {
        return removeMatching(() -> {
            final var store = snapshot.store();
            final List<PolicyRule> matches = new ArrayList<>();
            store.rules(DEFAULT_ROLE_KEY).stream().filter(r -> r.value(0).equals(subject)).forEach(matches::add);
            store.rules(PolicyStore.POLICY_SECTION).stream().filter(r -> r.value(0).equals(subject)).forEach(matches::add);
            return matches;
        });
    }

    @Override
    public boolean deleteRole(String role) {
        return removeMatching(() -> {
            final var store = snapshot.store();
            final List<PolicyRule> matches = new ArrayList<>();
            store.rules(DEFAULT_ROLE_KEY).stream()
                    .filter(r -> r.value(0).equals(role) || r.value(1).equals(role))
                    .forEach(matches::add);
            store.rules(PolicyStore.POLICY_SECTION).stream().filter(r -> r.value(0).equals(role)).forEach(matches::add);
            return matches;
        });
    }

    @Override
    public List<List<String>> getPermissionsForSubject(String subject) {
        return values(filtered(snapshot.store(), PolicyStore.POLICY_SECTION, 0, subject));
    }

    @Override
    public List<List<String>> getImplicitPermissionsForSubject(String subject) {
        final var current = snapshot;
        return implicitPermissions(current, subject, current.roleGraph(DEFAULT_ROLE_KEY).rolesOf(subject, null), r -> true);
    }

    @Override
    public List<List<String>> getImplicitPermissionsForSubject(String subject, String domain) {
        final var current = snapshot;
        final var roles = current.roleGraph(DEFAULT_ROLE_KEY).rolesOf(subject, domain);
        return implicitPermissions(
                current, subject, roles, rule -> rule.arity() > 1 && rule.value(1).equals(domain));
    }

    // -------------------------------------------------------------------------
    // Mutation core
    // -------------------------------------------------------------------------

    private boolean addRules(List<PolicyRule> rules) {
        mutationLock.lock();
        try {
            final var current = snapshot;
            rules.forEach(rule -> PolicyRuleValidator.validate(current.model(), rule));

            final var store = current.store().withRules(rules);
            if (store == current.store()) {
                return false;
            }
            final var added = rules.stream()
                    .filter(rule -> !current.store().contains(rule))
                    .distinct()
                    .toList();
            final var next = current.withChanges(store, added, List.of());
            if (autoSave) {
                persist(repository.addPolicies(added), "Auto-save failed to add rules");
            }
            snapshot = next;
            LOG.debugf("Added %d rule(s)", added.size());
            return true;
        } finally {
            mutationLock.unlock();
        }
    }

    private boolean removeRules(List<PolicyRule> rules) {
        mutationLock.lock();
        try {
            final var current = snapshot;
            final var store = current.store().withoutRules(rules);
            if (store == current.store()) {
                return false;
            }
            final var removed = rules.stream()
                    .filter(rule -> current.store().contains(rule))
                    .distinct()
                    .toList();
            final var next = current.withChanges(store, List.of(), removed);
            if (autoSave) {
                persist(repository.removePolicies(removed), "Auto-save failed to remove rules");
            }
            snapshot = next;
            LOG.debugf("Removed %d rule(s)", removed.size());
            return true;
        } finally {
            mutationLock.unlock();
        }
    }

    // Selection runs under the lock so it sees the same snapshot the removal applies to.
    private boolean removeMatching(Supplier<Iterable<PolicyRule>> selection) {
        mutationLock.lock();
        try {
            final List<PolicyRule> matches = new ArrayList<>();
            selection.get().forEach(matches::add);
            return !matches.isEmpty() && removeRules(matches);
        } finally {
            mutationLock.unlock();
        }
    }

    private void persist(Uni<Void> write, String failureMessage) {
        try {
            write.await().atMost(storageTimeout);
        } catch (PolicyEngineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PolicyMutationException(failureMessage + ": " + e.getMessage(), e);
        }
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private RoleGraph defaultGraph() {
        return snapshot.roleGraph(DEFAULT_ROLE_KEY);
    }

    private static Iterable<PolicyRule> filtered(
            PolicyStore store, String section, int fieldIndex, String... fieldValues) {
        final var filter = Arrays.asList(fieldValues);
        return () -> store.rules(section).stream()
                .filter(rule -> rule.matchesFilter(fieldIndex, filter))
                .iterator();
    }

    private List<List<String>> implicitPermissions(
            EngineSnapshot current, String subject, Set<String> roles, Predicate<PolicyRule> scope) {
        final Set<String> names = new LinkedHashSet<>();
        names.add(subject);
        names.addAll(roles);
        final List<List<String>> result = new ArrayList<>();
        for (var rule : current.store().rules(PolicyStore.POLICY_SECTION)) {
            if (names.contains(rule.value(0)) && scope.test(rule)) {
                result.add(rule.values());
            }
        }
        return result;
    }

    private List<String> distinctPolicyField(String field, int fallbackIndex) {
        final var current = snapshot;
        final var index = current.model().policy().indexOf(field).orElse(fallbackIndex);
        final Set<String> distinct = new LinkedHashSet<>();
        for (var rule : current.store().rules(PolicyStore.POLICY_SECTION)) {
            if (index < rule.arity()) {
                distinct.add(rule.value(index));
            }
        }
        return List.copyOf(distinct);
    }

    private static List<PolicyRule> toRules(String section, List<List<String>> rules) {
        if (rules == null) {
            throw new PolicyMutationException("Rules cannot be null");
        }
        return rules.stream().map(values -> PolicyRuleValidator.rule(section, values)).toList();
    }

    private static List<List<String>> values(Iterable<PolicyRule> rules) {
        final List<List<String>> result = new ArrayList<>();
        rules.forEach(rule -> result.add(rule.values()));
        return result;
    }
}
