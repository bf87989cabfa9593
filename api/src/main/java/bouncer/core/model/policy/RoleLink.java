package bouncer.core.model.policy;

/**
 * An edge in a role graph: {@code child} has or inherits {@code parent}.
 *
 * @param child  the subject or role that gains the parent's permissions
 * @param parent the role being granted
 * @param domain the tenant the link lives in, empty for un-scoped links
 */
public record RoleLink(String child, String parent, String domain) {

    public static final String NO_DOMAIN = "";

    public RoleLink {
        if (child == null || child.isEmpty()) {
            throw new IllegalArgumentException("Role link child cannot be null or empty");
        }
        if (parent == null || parent.isEmpty()) {
            throw new IllegalArgumentException("Role link parent cannot be null or empty");
        }
        if (domain == null) {
            domain = NO_DOMAIN;
        }
    }

    public static RoleLink of(String child, String parent) {
        return new RoleLink(child, parent, NO_DOMAIN);
    }

    public boolean hasDomain() {
        return !domain.isEmpty();
    }
}
