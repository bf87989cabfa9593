package bouncer.adapter.out.storage.memory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.jboss.logging.Logger;

import bouncer.core.model.policy.PolicyLineFormat;
import bouncer.core.model.policy.PolicyRule;
import bouncer.core.port.out.PolicyRepository;
import bouncer.spi.PolicyStorageProvider;
import bouncer.spi.StorageAdapterConfig;
import bouncer.spi.StorageProviderException;

/**
 * In-memory storage provider for policy rules.
 *
 * <p>Provides non-persistent storage suitable for development, testing,
 * and deployments whose policy ships with the application. The store can be
 * seeded from a classpath resource named by
 * {@code bouncer.policy.storage.memory.seed-resource}.
 *
 * <p>Data is NOT persisted across application restarts.
 */
public class InMemoryPolicyStorageProvider implements PolicyStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryPolicyStorageProvider.class);

    public static final String SEED_RESOURCE_KEY = "bouncer.policy.storage.memory.seed-resource";

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory policy storage (non-persistent)";
    }

    @Override
    public int priority() {
        return 0; // Lowest priority, used as fallback
    }

    @Override
    public PolicyRepository createRepository(StorageAdapterConfig config) {
        return config.get(SEED_RESOURCE_KEY)
                .map(resource -> new InMemoryPolicyRepository(seed(resource)))
                .orElseGet(InMemoryPolicyRepository::new);
    }

    private List<PolicyRule> seed(String resource) {
        final var name = resource.startsWith("/") ? resource.substring(1) : resource;
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                throw new StorageProviderException("Seed policy resource not found: " + resource);
            }
            final var text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            final var rules = PolicyLineFormat.parseAll(text.lines().toList(), resource);
            LOG.infof("Seeded in-memory policy storage with %d rule(s) from %s", rules.size(), resource);
            return rules;
        } catch (IOException e) {
            throw new StorageProviderException("Failed to read seed policy resource: " + resource, e);
        }
    }
}
