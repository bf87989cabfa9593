package bouncer.core.model.definition;

/**
 * A role-inheritance declaration such as {@code g = _, _} or {@code g2 = _, _, _}.
 *
 * @param key   the section key, also the name of the membership function
 * @param arity 2 for plain links, 3 when links are scoped by domain
 */
public record RoleDefinition(String key, int arity) {

    public static final int PLAIN_ARITY = 2;
    public static final int DOMAIN_ARITY = 3;

    public RoleDefinition {
        if (arity != PLAIN_ARITY && arity != DOMAIN_ARITY) {
            throw new IllegalArgumentException("Role definition '" + key + "' must declare 2 or 3 fields");
        }
    }

    public boolean hasDomain() {
        return arity == DOMAIN_ARITY;
    }
}
