package bouncer.core.service.policy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import bouncer.core.model.policy.PolicyRule;

@DisplayName("PolicyStore")
class PolicyStoreTest {

    private static final PolicyRule ALICE_READ = PolicyRule.of("p", "alice", "data1", "read");
    private static final PolicyRule BOB_WRITE = PolicyRule.of("p", "bob", "data2", "write");
    private static final PolicyRule ALICE_ADMIN = PolicyRule.of("g", "alice", "admin");

    @Nested
    @DisplayName("of()")
    class BuildTests {

        @Test
        @DisplayName("should deduplicate and keep insertion order per section")
        void shouldDeduplicate() {
            final var store = PolicyStore.of(
                    List.of(ALICE_READ, ALICE_ADMIN, BOB_WRITE, PolicyRule.of("p", "alice", "data1", "read")),
                    OptionalInt.empty());

            assertEquals(List.of(ALICE_READ, BOB_WRITE), store.rules("p"));
            assertEquals(List.of(ALICE_ADMIN), store.rules("g"));
            assertEquals(3, store.size());
            assertEquals(Set.of("p", "g"), store.sections());
        }

        @Test
        @DisplayName("should sort policy rules by ascending priority keeping ties stable")
        void shouldSortByPriority() {
            final var low = PolicyRule.of("p", "10", "alice", "data1", "read", "deny");
            final var high = PolicyRule.of("p", "1", "alice", "data1", "read", "allow");
            final var tie = PolicyRule.of("p", "1", "bob", "data1", "read", "allow");

            final var store = PolicyStore.of(List.of(low, high, tie), OptionalInt.of(0));

            assertEquals(List.of(high, tie, low), store.rules("p"));
        }

        @Test
        @DisplayName("should be empty for no rules")
        void shouldBeEmpty() {
            final var store = PolicyStore.of(List.of(), OptionalInt.empty());

            assertTrue(store.isEmpty());
            assertTrue(store.rules("p").isEmpty());
            assertEquals(0, store.size());
        }
    }

    @Nested
    @DisplayName("mutations")
    class MutationTests {

        private final PolicyStore store = PolicyStore.of(List.of(ALICE_READ, ALICE_ADMIN), OptionalInt.empty());

        @Test
        @DisplayName("should return the same store when adding an existing rule")
        void shouldDetectDuplicateAdd() {
            assertSame(store, store.withRule(PolicyRule.of("p", "alice", "data1", "read")));
        }

        @Test
        @DisplayName("should return the same store when removing an absent rule")
        void shouldDetectAbsentRemove() {
            assertSame(store, store.withoutRule(BOB_WRITE));
            assertSame(store, store.withoutRules(List.of(BOB_WRITE, PolicyRule.of("g", "bob", "admin"))));
        }

        @Test
        @DisplayName("should leave the original store untouched")
        void shouldBeCopyOnWrite() {
            final var added = store.withRule(BOB_WRITE);

            assertNotSame(store, added);
            assertFalse(store.contains(BOB_WRITE));
            assertTrue(added.contains(BOB_WRITE));
            assertEquals(List.of(ALICE_READ, BOB_WRITE), added.rules("p"));
        }

        @Test
        @DisplayName("should drop a section when its last rule is removed")
        void shouldDropEmptySection() {
            final var removed = store.withoutRules(List.of(ALICE_ADMIN));

            assertFalse(removed.sections().contains("g"));
            assertEquals(1, removed.size());
        }

        @Test
        @DisplayName("should insert by priority after equal priorities")
        void shouldInsertByPriority() {
            final var first = PolicyRule.of("p", "1", "alice", "data1", "read", "allow");
            final var last = PolicyRule.of("p", "5", "alice", "data1", "read", "deny");
            final var middle = PolicyRule.of("p", "1", "bob", "data1", "read", "allow");

            final var prioritized = PolicyStore.of(List.of(first, last), OptionalInt.of(0)).withRule(middle);

            assertEquals(List.of(first, middle, last), prioritized.rules("p"));
        }

        @Test
        @DisplayName("should add several rules at once")
        void shouldAddBatch() {
            final var added = store.withRules(List.of(BOB_WRITE, ALICE_READ));

            assertEquals(3, added.size());
            assertEquals(List.of(ALICE_READ, ALICE_ADMIN, BOB_WRITE), added.allRules());
        }
    }

    @Nested
    @DisplayName("allRules()")
    class FilterTests {

        @Test
        @DisplayName("should match leading values and treat empty values as wildcards")
        void shouldFilterByPrefix() {
            final var store = PolicyStore.of(List.of(ALICE_READ, BOB_WRITE, PolicyRule.of("p", "alice", "data2", "write")),
                    OptionalInt.empty());

            final List<PolicyRule> alice = new ArrayList<>();
            store.allRules("p", "alice").forEach(alice::add);
            final List<PolicyRule> writers = new ArrayList<>();
            store.allRules("p", "", "data2").forEach(writers::add);

            assertEquals(2, alice.size());
            assertEquals(List.of(BOB_WRITE, PolicyRule.of("p", "alice", "data2", "write")), writers);
        }

        @Test
        @DisplayName("should not observe later mutations")
        void shouldBeStableView() {
            final var store = PolicyStore.of(List.of(ALICE_READ), OptionalInt.empty());
            final var view = store.allRules("p");

            store.withRule(BOB_WRITE);

            final List<PolicyRule> seen = new ArrayList<>();
            view.forEach(seen::add);
            assertEquals(List.of(ALICE_READ), seen);
        }
    }
}
