package bouncer.adapter.in.rest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import bouncer.adapter.out.storage.memory.InMemoryPolicyRepository;
import bouncer.core.service.TestModels;
import bouncer.core.service.compiler.ModelCompiler;
import bouncer.core.service.enforcer.Enforcer;

@DisplayName("RoleAssignmentResource")
class RoleAssignmentResourceTest {

    @Test
    @DisplayName("should assign list and revoke un-scoped roles")
    void shouldManageRoles() {
        final var enforcer = new Enforcer(new ModelCompiler(), TestModels.RBAC, new InMemoryPolicyRepository());
        final var resource = new RoleAssignmentResource(enforcer);

        assertTrue(resource.assignRole("alice", "admin", null).changed());
        assertTrue(resource.assignRole("admin", "viewer", "").changed());
        assertFalse(resource.assignRole("alice", "admin", null).changed());

        final var assignments = resource.getRoles("alice", null);
        assertNull(assignments.domain());
        assertEquals(List.of("admin"), assignments.roles());
        assertEquals(List.of("admin", "viewer"), assignments.implicitRoles());

        assertTrue(resource.revokeRole("alice", "admin", null).changed());
        assertTrue(resource.getRoles("alice", null).roles().isEmpty());
    }

    @Test
    @DisplayName("should scope assignments by the domain parameter")
    void shouldManageDomainRoles() {
        final var enforcer = new Enforcer(
                new ModelCompiler(), TestModels.RBAC_WITH_DOMAINS, new InMemoryPolicyRepository());
        final var resource = new RoleAssignmentResource(enforcer);

        resource.assignRole("alice", "admin", "tenant1");

        assertEquals(List.of("admin"), resource.getRoles("alice", "tenant1").roles());
        assertTrue(resource.getRoles("alice", "tenant2").roles().isEmpty());
        assertFalse(resource.revokeRole("alice", "admin", "tenant2").changed());
        assertTrue(resource.revokeRole("alice", "admin", "tenant1").changed());
    }
}
