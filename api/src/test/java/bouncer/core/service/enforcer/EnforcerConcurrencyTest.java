package bouncer.core.service.enforcer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import bouncer.adapter.out.storage.memory.InMemoryPolicyRepository;
import bouncer.core.model.policy.PolicyRule;
import bouncer.core.service.TestModels;
import bouncer.core.service.compiler.ModelCompiler;

@DisplayName("Enforcer under concurrent use")
class EnforcerConcurrencyTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(8);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("should serialize concurrent additions without losing any")
    void shouldNotLoseConcurrentAdditions() throws Exception {
        final var enforcer = new Enforcer(new ModelCompiler(), TestModels.RBAC, new InMemoryPolicyRepository());
        final var start = new CountDownLatch(1);
        final List<Future<?>> futures = new ArrayList<>();

        for (var t = 0; t < 8; t++) {
            final var thread = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (var i = 0; i < 200; i++) {
                    enforcer.addPolicy("user" + thread, "/data/" + i, "GET");
                    enforcer.addGroupingPolicy("user" + thread, "role" + i);
                }
                return null;
            }));
        }
        start.countDown();
        for (var future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }

        assertEquals(1_600, enforcer.getPolicy().size());
        assertEquals(1_600, enforcer.getGroupingPolicy().size());
        assertEquals(200, enforcer.getRolesForSubject("user3").size());
    }

    @Test
    @DisplayName("should show readers either the old or the new policy during reloads")
    void shouldSwapPolicyAtomically() throws Exception {
        final var enforcer = new Enforcer(new ModelCompiler(), TestModels.RBAC, new InMemoryPolicyRepository());
        // Both sets grant alice access, through a role in one and directly in the other.
        final var viaRole = List.of(PolicyRule.of("p", "admin", "/data", "GET"), PolicyRule.of("g", "alice", "admin"));
        final var direct = List.of(PolicyRule.of("p", "alice", "/data", "GET"));
        enforcer.loadPolicy(viaRole);

        final var running = new AtomicBoolean(true);
        final List<Future<Integer>> readers = new ArrayList<>();
        for (var r = 0; r < 4; r++) {
            readers.add(executor.submit(() -> {
                var denials = 0;
                while (running.get()) {
                    if (!enforcer.enforce("alice", "/data", "GET")) {
                        denials++;
                    }
                }
                return denials;
            }));
        }

        for (var i = 0; i < 2_000; i++) {
            enforcer.loadPolicy(i % 2 == 0 ? direct : viaRole);
        }
        running.set(false);

        var denials = 0;
        for (var reader : readers) {
            denials += reader.get(30, TimeUnit.SECONDS);
        }
        assertEquals(0, denials);
        assertTrue(enforcer.enforce("alice", "/data", "GET"));
    }
}
