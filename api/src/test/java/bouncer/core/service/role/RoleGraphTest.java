package bouncer.core.service.role;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import bouncer.core.model.policy.RoleLink;

@DisplayName("RoleGraph")
class RoleGraphTest {

    @Nested
    @DisplayName("hasLink()")
    class HasLinkTests {

        @Test
        @DisplayName("should follow inheritance transitively")
        void shouldBeTransitive() {
            final var graph = RoleGraph.of(List.of(RoleLink.of("alice", "admin"), RoleLink.of("admin", "user")));

            assertTrue(graph.hasLink("alice", "admin", null));
            assertTrue(graph.hasLink("alice", "user", null));
            assertFalse(graph.hasLink("user", "alice", null));
        }

        @Test
        @DisplayName("should treat every name as reaching itself")
        void shouldBeReflexive() {
            assertTrue(RoleGraph.empty().hasLink("alice", "alice", ""));
        }

        @Test
        @DisplayName("should terminate on cycles without granting unrelated roles")
        void shouldTerminateOnCycles() {
            final var graph = RoleGraph.of(List.of(
                    RoleLink.of("a", "b"), RoleLink.of("b", "a"), RoleLink.of("b", "c"), RoleLink.of("x", "y")));

            assertTimeoutPreemptively(Duration.ofSeconds(1), () -> {
                assertTrue(graph.hasLink("a", "c", null));
                assertTrue(graph.hasLink("b", "a", null));
                assertFalse(graph.hasLink("a", "y", null));
                assertFalse(graph.hasLink("c", "a", null));
            });
        }

        @Test
        @DisplayName("should keep domains independent")
        void shouldPartitionByDomain() {
            final var graph = RoleGraph.of(List.of(new RoleLink("alice", "admin", "tenant1")));

            assertTrue(graph.hasLink("alice", "admin", "tenant1"));
            assertFalse(graph.hasLink("alice", "admin", "tenant2"));
            assertFalse(graph.hasLink("alice", "admin", null));
        }

        @Test
        @DisplayName("should handle long chains")
        void shouldHandleLongChains() {
            final List<RoleLink> links = new ArrayList<>();
            for (var i = 0; i < 5_000; i++) {
                links.add(RoleLink.of("r" + i, "r" + (i + 1)));
            }
            final var graph = RoleGraph.of(links);

            assertTrue(graph.hasLink("r0", "r5000", null));
            assertFalse(graph.hasLink("r5000", "r0", null));
        }
    }

    @Nested
    @DisplayName("rolesOf() and usersOf()")
    class ClosureTests {

        private final RoleGraph graph = RoleGraph.of(List.of(
                RoleLink.of("alice", "admin"),
                RoleLink.of("bob", "editor"),
                RoleLink.of("admin", "editor"),
                RoleLink.of("editor", "viewer"),
                RoleLink.of("viewer", "editor")));

        @Test
        @DisplayName("should return the transitive roles excluding the subject")
        void shouldReturnTransitiveRoles() {
            assertEquals(Set.of("admin", "editor", "viewer"), graph.rolesOf("alice", null));
            assertEquals(Set.of("viewer"), graph.rolesOf("editor", null));
        }

        @Test
        @DisplayName("should return every subject reaching a role")
        void shouldReturnTransitiveUsers() {
            assertEquals(Set.of("alice", "admin", "bob", "viewer"), graph.usersOf("editor", null));
        }

        @Test
        @DisplayName("should return direct neighbours only")
        void shouldReturnDirectNeighbours() {
            assertEquals(Set.of("admin"), graph.directRolesOf("alice", null));
            assertEquals(Set.of("bob", "admin", "viewer"), graph.directUsersOf("editor", null));
        }

        @Test
        @DisplayName("should return nothing for unknown names")
        void shouldReturnEmptyForUnknown() {
            assertTrue(graph.rolesOf("nobody", null).isEmpty());
            assertTrue(graph.usersOf("nothing", "tenant").isEmpty());
        }
    }

    @Nested
    @DisplayName("withLink() and withoutLink()")
    class MutationTests {

        @Test
        @DisplayName("should leave the original graph untouched")
        void shouldBeCopyOnWrite() {
            final var original = RoleGraph.of(List.of(RoleLink.of("alice", "admin")));

            final var extended = original.withLink(RoleLink.of("admin", "root"));

            assertFalse(original.hasLink("alice", "root", null));
            assertTrue(extended.hasLink("alice", "root", null));
            assertEquals(1, original.size());
            assertEquals(2, extended.size());
        }

        @Test
        @DisplayName("should return the same instance for no-op changes")
        void shouldDetectNoOps() {
            final var graph = RoleGraph.of(List.of(RoleLink.of("alice", "admin")));

            assertSame(graph, graph.withLink(RoleLink.of("alice", "admin")));
            assertSame(graph, graph.withoutLink(RoleLink.of("bob", "admin")));
        }

        @Test
        @DisplayName("should cut reachability when a link is removed")
        void shouldRemoveLink() {
            final var graph = RoleGraph.of(List.of(RoleLink.of("alice", "admin"), RoleLink.of("admin", "user")))
                    .withoutLink(RoleLink.of("admin", "user"));

            assertFalse(graph.hasLink("alice", "user", null));
            assertTrue(graph.hasLink("alice", "admin", null));
            assertEquals(1, graph.links().size());
        }

        @Test
        @DisplayName("should count duplicate links once")
        void shouldDeduplicate() {
            final var graph = RoleGraph.of(List.of(RoleLink.of("alice", "admin"), RoleLink.of("alice", "admin")));

            assertEquals(1, graph.size());
        }
    }
}
