package bouncer.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import bouncer.core.model.policy.PolicyRule;
import bouncer.core.port.out.PolicyRepository;

/**
 * In-memory implementation of PolicyRepository.
 *
 * <p>Data is NOT persisted across restarts. This implementation is suitable for:
 * <ul>
 *   <li>Development and testing</li>
 *   <li>Deployments that load a fixed policy at startup</li>
 *   <li>Fallback when no persistent storage provider is available</li>
 * </ul>
 *
 * <p>Thread-safety: all access is synchronized on the rule set.
 */
public class InMemoryPolicyRepository implements PolicyRepository {

    private final Set<PolicyRule> storage = new LinkedHashSet<>();

    public InMemoryPolicyRepository() {}

    public InMemoryPolicyRepository(Collection<PolicyRule> initialRules) {
        storage.addAll(initialRules);
    }

    @Override
    public Uni<List<PolicyRule>> loadPolicy() {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return List.copyOf(storage);
            }
        });
    }

    @Override
    public Uni<Void> savePolicy(List<PolicyRule> rules) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                storage.clear();
                storage.addAll(rules);
            }
            return null;
        });
    }

    @Override
    public Uni<Void> addPolicies(List<PolicyRule> rules) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                storage.addAll(rules);
            }
            return null;
        });
    }

    @Override
    public Uni<Void> removePolicies(List<PolicyRule> rules) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                rules.forEach(storage::remove);
            }
            return null;
        });
    }

    /**
     * @return a copy of the stored rules, for inspection
     */
    public List<PolicyRule> snapshot() {
        synchronized (storage) {
            return new ArrayList<>(storage);
        }
    }
}
