package bouncer.adapter.in.dto;

import java.util.List;

/**
 * DTO for a subject's roles.
 *
 * @param subject       the subject
 * @param domain        the domain queried, or null for un-scoped roles
 * @param roles         roles assigned directly
 * @param implicitRoles every role reached through inheritance
 */
public record RoleAssignmentsDto(String subject, String domain, List<String> roles, List<String> implicitRoles) {}
