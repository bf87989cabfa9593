package bouncer.spi;

import java.util.Optional;

/**
 * Read access to the {@code bouncer.policy.storage.*} settings a policy storage
 * provider needs, independent of the configuration framework behind them.
 */
public interface StorageAdapterConfig {

    /**
     * @param key the full configuration key
     * @return the configured value
     * @throws StorageProviderException if the key is not set
     */
    String getRequired(String key);

    Optional<String> get(String key);
}
