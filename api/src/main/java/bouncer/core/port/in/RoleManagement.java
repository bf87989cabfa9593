package bouncer.core.port.in;

import java.util.List;

/**
 * Port for role-based access control over the default role definition {@code g}.
 *
 * <p>Methods taking a domain apply to models whose {@code g} declares three
 * fields; the domain-less variants apply to two-field definitions.
 */
public interface RoleManagement {

    boolean addRoleForSubject(String subject, String role);

    boolean addRoleForSubject(String subject, String role, String domain);

    boolean deleteRoleForSubject(String subject, String role);

    boolean deleteRoleForSubject(String subject, String role, String domain);

    /**
     * @return roles assigned directly to the subject
     */
    List<String> getRolesForSubject(String subject);

    List<String> getRolesForSubject(String subject, String domain);

    /**
     * @return every role the subject reaches through inheritance
     */
    List<String> getImplicitRolesForSubject(String subject);

    List<String> getImplicitRolesForSubject(String subject, String domain);

    /**
     * @return subjects and roles that have the role directly
     */
    List<String> getUsersForRole(String role);

    List<String> getUsersForRole(String role, String domain);

    /**
     * @return true if the subject reaches the role, directly or transitively
     */
    boolean hasRoleForSubject(String subject, String role);

    boolean hasRoleForSubject(String subject, String role, String domain);

    /**
     * Remove a subject from every role and every policy rule naming it.
     *
     * @return true if anything was removed
     */
    boolean deleteSubject(String subject);

    /**
     * Remove a role from every assignment and every policy rule naming it.
     *
     * @return true if anything was removed
     */
    boolean deleteRole(String role);

    /**
     * @return policy rules whose first field is the subject
     */
    List<List<String>> getPermissionsForSubject(String subject);

    /**
     * @return policy rules for the subject and every role it reaches
     */
    List<List<String>> getImplicitPermissionsForSubject(String subject);

    List<List<String>> getImplicitPermissionsForSubject(String subject, String domain);
}
