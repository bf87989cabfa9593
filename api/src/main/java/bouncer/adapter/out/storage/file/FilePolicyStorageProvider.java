package bouncer.adapter.out.storage.file;

import java.nio.file.Path;

import bouncer.core.port.out.PolicyRepository;
import bouncer.spi.PolicyStorageProvider;
import bouncer.spi.StorageAdapterConfig;

/**
 * File-backed storage provider for policy rules.
 *
 * <p>Available only when {@code bouncer.policy.storage.file.path} is set.
 */
public class FilePolicyStorageProvider implements PolicyStorageProvider {

    public static final String PATH_KEY = "bouncer.policy.storage.file.path";

    @Override
    public String name() {
        return "file";
    }

    @Override
    public String description() {
        return "Line-oriented policy file storage";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable(StorageAdapterConfig config) {
        return config.get(PATH_KEY).filter(p -> !p.isBlank()).isPresent();
    }

    @Override
    public PolicyRepository createRepository(StorageAdapterConfig config) {
        return new FilePolicyRepository(Path.of(config.getRequired(PATH_KEY)));
    }
}
