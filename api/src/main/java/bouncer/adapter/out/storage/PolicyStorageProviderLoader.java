package bouncer.adapter.out.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import bouncer.core.port.out.PolicyRepository;
import bouncer.spi.PolicyStorageProvider;
import bouncer.spi.StorageAdapterConfig;
import bouncer.spi.StorageProviderException;

/**
 * Discovers and loads policy storage providers via ServiceLoader.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If bouncer.policy.storage.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 *
 * <p>Thread-safety: Uses synchronized methods for lazy provider initialization
 * to ensure thread-safe access from CDI producer methods.
 */
@ApplicationScoped
public class PolicyStorageProviderLoader {

    private static final Logger LOG = Logger.getLogger(PolicyStorageProviderLoader.class);

    private final Optional<String> configuredStorageProvider;
    private final StorageAdapterConfig config;
    private final List<PolicyStorageProvider> discovered;

    private PolicyStorageProvider storageProvider;

    @Inject
    public PolicyStorageProviderLoader(
            @ConfigProperty(name = "bouncer.policy.storage.provider") Optional<String> configuredStorageProvider,
            StorageAdapterConfig config) {
        this(configuredStorageProvider, config, null);
    }

    PolicyStorageProviderLoader(
            Optional<String> configuredStorageProvider,
            StorageAdapterConfig config,
            List<PolicyStorageProvider> discovered) {
        this.configuredStorageProvider = configuredStorageProvider;
        this.config = config;
        this.discovered = discovered;
    }

    @Produces
    @ApplicationScoped
    public PolicyRepository policyRepository() {
        final var provider = getStorageProvider();
        LOG.infof("Creating policy repository from provider: %s (%s)", provider.name(), provider.description());
        return provider.createRepository(config);
    }

    synchronized PolicyStorageProvider getStorageProvider() {
        if (storageProvider != null) {
            return storageProvider;
        }

        final List<PolicyStorageProvider> providers = new ArrayList<>();
        if (discovered != null) {
            providers.addAll(discovered);
        } else {
            ServiceLoader.load(PolicyStorageProvider.class).forEach(providers::add);
        }

        if (providers.isEmpty()) {
            throw new StorageProviderException(
                    "No policy storage providers found. Ensure a provider JAR is on the classpath.");
        }

        LOG.infof(
                "Found %d policy storage provider(s): %s",
                providers.size(),
                providers.stream().map(PolicyStorageProvider::name).toList());

        storageProvider = selectProvider(providers, configuredStorageProvider.orElse(null));

        return storageProvider;
    }

    private PolicyStorageProvider selectProvider(List<PolicyStorageProvider> providers, String configured) {
        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new StorageProviderException("Configured policy storage provider not found: "
                            + configured + ". Available: "
                            + providers.stream().map(PolicyStorageProvider::name).toList()));
        }

        return providers.stream()
                .filter(p -> p.isAvailable(config))
                .max(Comparator.comparingInt(PolicyStorageProvider::priority))
                .orElseThrow(() -> new StorageProviderException("No available policy storage providers"));
    }
}
