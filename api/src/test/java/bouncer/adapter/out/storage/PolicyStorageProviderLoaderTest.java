package bouncer.adapter.out.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import bouncer.adapter.out.storage.file.FilePolicyRepository;
import bouncer.adapter.out.storage.file.FilePolicyStorageProvider;
import bouncer.adapter.out.storage.memory.InMemoryPolicyRepository;
import bouncer.adapter.out.storage.memory.InMemoryPolicyStorageProvider;
import bouncer.core.model.policy.PolicyRule;
import bouncer.spi.PolicyStorageProvider;
import bouncer.spi.StorageProviderException;

@DisplayName("PolicyStorageProviderLoader")
class PolicyStorageProviderLoaderTest {

    private static final List<PolicyStorageProvider> PROVIDERS =
            List.of(new InMemoryPolicyStorageProvider(), new FilePolicyStorageProvider());

    private static PolicyStorageProviderLoader loader(Optional<String> configured, Map<String, String> config) {
        return new PolicyStorageProviderLoader(configured, new MapStorageAdapterConfig(config), PROVIDERS);
    }

    @Nested
    @DisplayName("provider selection")
    class SelectionTests {

        @Test
        @DisplayName("should fall back to memory when no file path is configured")
        void shouldFallBackToMemory() {
            final var loader = loader(Optional.empty(), Map.of());

            assertEquals("memory", loader.getStorageProvider().name());
            assertInstanceOf(InMemoryPolicyRepository.class, loader.policyRepository());
        }

        @Test
        @DisplayName("should prefer the file provider when it is available")
        void shouldPreferAvailableHigherPriority() {
            final var loader = loader(Optional.empty(), Map.of(FilePolicyStorageProvider.PATH_KEY, "/tmp/policy.csv"));

            final var repository = loader.policyRepository();

            assertInstanceOf(FilePolicyRepository.class, repository);
            assertEquals("/tmp/policy.csv", ((FilePolicyRepository) repository).path().toString());
        }

        @Test
        @DisplayName("should honour an explicitly configured provider")
        void shouldUseConfiguredProvider() {
            final var loader = loader(Optional.of("memory"), Map.of(FilePolicyStorageProvider.PATH_KEY, "/tmp/x.csv"));

            assertEquals("memory", loader.getStorageProvider().name());
        }

        @Test
        @DisplayName("should fail for an unknown configured provider")
        void shouldRejectUnknownProvider() {
            final var loader = loader(Optional.of("cassandra"), Map.of());

            final var e = assertThrows(StorageProviderException.class, loader::getStorageProvider);

            assertTrue(e.getMessage().contains("cassandra"));
        }

        @Test
        @DisplayName("should fail when nothing is discovered")
        void shouldRejectEmptyDiscovery() {
            final var loader = new PolicyStorageProviderLoader(Optional.empty(), new MapStorageAdapterConfig(Map.of()), List.of());

            assertThrows(StorageProviderException.class, loader::getStorageProvider);
        }

        @Test
        @DisplayName("should select once and reuse the choice")
        void shouldCacheSelection() {
            final var loader = loader(Optional.empty(), Map.of());

            assertSame(loader.getStorageProvider(), loader.getStorageProvider());
        }
    }

    @Nested
    @DisplayName("memory provider seeding")
    class SeedTests {

        @Test
        @DisplayName("should seed the repository from a classpath resource")
        void shouldSeedFromResource() {
            final var repository = new InMemoryPolicyStorageProvider().createRepository(new MapStorageAdapterConfig(
                    Map.of(InMemoryPolicyStorageProvider.SEED_RESOURCE_KEY, "seed-policy.csv")));

            final var rules = repository.loadPolicy().await().atMost(Duration.ofSeconds(1));

            assertEquals(List.of(PolicyRule.of("p", "admin", "/data", "GET"), PolicyRule.of("g", "alice", "admin")), rules);
        }

        @Test
        @DisplayName("should fail when the seed resource is missing")
        void shouldRejectMissingSeed() {
            final var provider = new InMemoryPolicyStorageProvider();
            final var config = new MapStorageAdapterConfig(
                    Map.of(InMemoryPolicyStorageProvider.SEED_RESOURCE_KEY, "missing.csv"));

            assertThrows(StorageProviderException.class, () -> provider.createRepository(config));
        }
    }
}
