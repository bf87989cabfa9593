package bouncer.adapter.out.storage.file;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import bouncer.core.model.PolicyMutationException;
import bouncer.core.model.policy.PolicyRule;

@DisplayName("FilePolicyRepository")
class FilePolicyRepositoryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @TempDir
    Path directory;

    private Path file;
    private FilePolicyRepository repository;

    @BeforeEach
    void setUp() {
        file = directory.resolve("policy.csv");
        repository = new FilePolicyRepository(file);
    }

    @Test
    @DisplayName("should read a missing file as an empty policy")
    void shouldReadMissingFileAsEmpty() {
        assertTrue(repository.loadPolicy().await().atMost(TIMEOUT).isEmpty());
    }

    @Test
    @DisplayName("should parse rules and skip comments and blank lines")
    void shouldParseFile() throws IOException {
        Files.writeString(file, """
                # policy
                p, alice, /data, GET

                g, alice, admin
                """, StandardCharsets.UTF_8);

        final var rules = repository.loadPolicy().await().atMost(TIMEOUT);

        assertEquals(List.of(PolicyRule.of("p", "alice", "/data", "GET"), PolicyRule.of("g", "alice", "admin")), rules);
    }

    @Test
    @DisplayName("should report malformed lines with their position")
    void shouldReportMalformedLines() throws IOException {
        Files.writeString(file, "p, alice, /data, GET\np, \"unterminated\n", StandardCharsets.UTF_8);

        final var e = assertThrows(PolicyMutationException.class, () -> repository.loadPolicy().await().atMost(TIMEOUT));

        assertTrue(e.getMessage().contains(":2:"), e.getMessage());
    }

    @Test
    @DisplayName("should round-trip values that need quoting")
    void shouldPreserveQuotedValues() {
        final var rule = PolicyRule.of("p", "r.sub.age > 18, r.sub.name == \"x\"", "/data", "GET");

        repository.savePolicy(List.of(rule)).await().atMost(TIMEOUT);

        assertEquals(List.of(rule), repository.loadPolicy().await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should append additions and rewrite on removal")
    void shouldAppendAndRemove() throws IOException {
        final var read = PolicyRule.of("p", "alice", "/data", "GET");
        final var write = PolicyRule.of("p", "alice", "/data", "POST");

        repository.addPolicies(List.of(read)).await().atMost(TIMEOUT);
        repository.addPolicy(write).await().atMost(TIMEOUT);
        repository.removePolicy(read).await().atMost(TIMEOUT);

        assertEquals(List.of("p, alice, /data, POST"), Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should replace the file on save without leaving temporary files")
    void shouldReplaceOnSave() throws IOException {
        repository.addPolicy(PolicyRule.of("p", "old", "/x", "GET")).await().atMost(TIMEOUT);

        repository.savePolicy(List.of(PolicyRule.of("g", "alice", "admin"))).await().atMost(TIMEOUT);

        assertEquals(List.of("g, alice, admin"), Files.readAllLines(file, StandardCharsets.UTF_8));
        try (var entries = Files.list(directory)) {
            assertEquals(1, entries.count());
        }
    }
}
