package bouncer.adapter.out.storage;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.Config;

import bouncer.spi.StorageAdapterConfig;
import bouncer.spi.StorageProviderException;

/**
 * Storage provider settings read from MicroProfile Config.
 */
@ApplicationScoped
public class MicroProfileStorageAdapterConfig implements StorageAdapterConfig {

    private final Config config;

    @Inject
    public MicroProfileStorageAdapterConfig(Config config) {
        this.config = config;
    }

    @Override
    public String getRequired(String key) {
        return get(key).orElseThrow(() -> new StorageProviderException("Missing policy storage setting: " + key));
    }

    @Override
    public Optional<String> get(String key) {
        return config.getOptionalValue(key, String.class);
    }
}
