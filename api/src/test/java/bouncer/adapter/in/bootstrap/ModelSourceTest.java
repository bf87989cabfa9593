package bouncer.adapter.in.bootstrap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import bouncer.adapter.out.storage.MapStorageAdapterConfig;
import bouncer.adapter.out.storage.memory.InMemoryPolicyStorageProvider;
import bouncer.core.model.ModelCompileException;
import bouncer.core.service.TestModels;
import bouncer.core.service.compiler.ModelCompiler;
import bouncer.core.service.enforcer.Enforcer;

@DisplayName("ModelSource")
class ModelSourceTest {

    @TempDir
    Path directory;

    @Test
    @DisplayName("should read a model from the classpath")
    void shouldReadClasspathModel() {
        assertTrue(ModelSource.read("/model.conf").contains("[matchers]"));
    }

    @Test
    @DisplayName("should fall back to the file system")
    void shouldReadFileModel() throws IOException {
        final var file = directory.resolve("acl.conf");
        Files.writeString(file, TestModels.ACL, StandardCharsets.UTF_8);

        assertEquals(TestModels.ACL, ModelSource.read(file.toString()));
    }

    @Test
    @DisplayName("should fail for a model that exists nowhere")
    void shouldRejectMissingModel() {
        assertThrows(ModelCompileException.class, () -> ModelSource.read(directory.resolve("none.conf").toString()));
    }

    @Test
    @DisplayName("should decide requests with the bundled model and seed policy")
    void shouldServeBundledPolicy() {
        final var repository = new InMemoryPolicyStorageProvider().createRepository(new MapStorageAdapterConfig(
                Map.of(InMemoryPolicyStorageProvider.SEED_RESOURCE_KEY, "policy.csv")));
        final var enforcer = new Enforcer(new ModelCompiler(), ModelSource.read("model.conf"), repository);
        enforcer.loadPolicy().await().atMost(Duration.ofSeconds(1));

        assertTrue(enforcer.enforce("alice", "/admin/policies", "POST"));
        assertTrue(enforcer.enforce("bob", "/data/7", "PUT"));
        assertTrue(enforcer.enforce("bob", "/data/7", "GET"));
        assertFalse(enforcer.enforce("bob", "/admin/policies", "GET"));
        assertFalse(enforcer.enforce("carol", "/data/7", "GET"));
    }
}
