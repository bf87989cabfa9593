package bouncer.adapter.out.storage;

import java.util.Map;
import java.util.Optional;

import bouncer.spi.StorageAdapterConfig;
import bouncer.spi.StorageProviderException;

/**
 * Map-backed configuration for storage tests.
 */
public class MapStorageAdapterConfig implements StorageAdapterConfig {

    private final Map<String, String> values;

    public MapStorageAdapterConfig(Map<String, String> values) {
        this.values = values;
    }

    @Override
    public String getRequired(String key) {
        return get(key).orElseThrow(() -> new StorageProviderException("Missing policy storage setting: " + key));
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }
}
