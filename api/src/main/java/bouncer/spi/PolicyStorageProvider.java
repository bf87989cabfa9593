package bouncer.spi;

import bouncer.core.port.out.PolicyRepository;

/**
 * Service Provider Interface for policy storage backends.
 *
 * <p>Providers are discovered via ServiceLoader. Configure the preferred
 * provider with bouncer.policy.storage.provider, or let the loader
 * select the highest priority available provider.
 *
 * <p>To implement a custom provider:
 * <ol>
 *   <li>Implement this interface</li>
 *   <li>Create a META-INF/services/bouncer.spi.PolicyStorageProvider file</li>
 *   <li>Add the fully qualified class name to the file</li>
 * </ol>
 */
public interface PolicyStorageProvider {

    /**
     * Get the provider name.
     *
     * @return short name for configuration (e.g., "memory", "file")
     */
    String name();

    /**
     * Get the provider description.
     *
     * @return human-readable description
     */
    String description();

    /**
     * Get the provider priority.
     *
     * <p>Higher priority providers are preferred when auto-selecting.
     * Memory provider should use 0, persistent providers should use higher values.
     *
     * @return priority value (higher = more preferred)
     */
    int priority();

    /**
     * Check if this provider can be used with the given configuration.
     *
     * @param config configuration adapter
     * @return true if the provider can be used
     */
    default boolean isAvailable(StorageAdapterConfig config) {
        return true;
    }

    /**
     * Create the policy repository.
     *
     * @param config configuration adapter
     * @return the repository instance
     */
    PolicyRepository createRepository(StorageAdapterConfig config);
}
