package bouncer.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import bouncer.adapter.in.dto.MutationResultDto;
import bouncer.adapter.in.dto.RoleAssignmentsDto;
import bouncer.core.port.in.RoleManagement;

/**
 * REST resource for a subject's role assignments.
 *
 * <p>The optional {@code domain} query parameter selects a tenant when the
 * model's role definition declares one.
 */
@Path("/admin/roles/{subject}")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class RoleAssignmentResource {

    private final RoleManagement roles;

    @Inject
    public RoleAssignmentResource(RoleManagement roles) {
        this.roles = roles;
    }

    @GET
    public RoleAssignmentsDto getRoles(@PathParam("subject") String subject, @QueryParam("domain") String domain) {
        if (domain == null || domain.isEmpty()) {
            return new RoleAssignmentsDto(
                    subject, null, roles.getRolesForSubject(subject), roles.getImplicitRolesForSubject(subject));
        }
        return new RoleAssignmentsDto(
                subject,
                domain,
                roles.getRolesForSubject(subject, domain),
                roles.getImplicitRolesForSubject(subject, domain));
    }

    @PUT
    @Path("/{role}")
    public MutationResultDto assignRole(
            @PathParam("subject") String subject,
            @PathParam("role") String role,
            @QueryParam("domain") String domain) {
        final var changed = domain == null || domain.isEmpty()
                ? roles.addRoleForSubject(subject, role)
                : roles.addRoleForSubject(subject, role, domain);
        return new MutationResultDto(changed);
    }

    @DELETE
    @Path("/{role}")
    public MutationResultDto revokeRole(
            @PathParam("subject") String subject,
            @PathParam("role") String role,
            @QueryParam("domain") String domain) {
        final var changed = domain == null || domain.isEmpty()
                ? roles.deleteRoleForSubject(subject, role)
                : roles.deleteRoleForSubject(subject, role, domain);
        return new MutationResultDto(changed);
    }
}
