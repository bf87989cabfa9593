package bouncer.core.service;

/**
 * Model texts shared by the engine tests.
 */
public final class TestModels {

    public static final String ACL = """
            [request_definition]
            r = sub, obj, act

            [policy_definition]
            p = sub, obj, act

            [policy_effect]
            e = some(where (p.eft == allow))

            [matchers]
            m = r.sub == p.sub && r.obj == p.obj && r.act == p.act
            """;

    public static final String RBAC = """
            [request_definition]
            r = sub, obj, act

            [policy_definition]
            p = sub, obj, act

            [role_definition]
            g = _, _

            [policy_effect]
            e = some(where (p.eft == allow))

            [matchers]
            m = g(r.sub, p.sub) && r.obj == p.obj && r.act == p.act
            """;

    public static final String RBAC_WITH_DOMAINS = """
            [request_definition]
            r = sub, dom, obj, act

            [policy_definition]
            p = sub, dom, obj, act

            [role_definition]
            g = _, _, _

            [policy_effect]
            e = some(where (p.eft == allow))

            [matchers]
            m = g(r.sub, p.sub, r.dom) && r.dom == p.dom && r.obj == p.obj && r.act == p.act
            """;

    public static final String RBAC_DENY_OVERRIDE = """
            [request_definition]
            r = sub, obj, act

            [policy_definition]
            p = sub, obj, act, eft

            [role_definition]
            g = _, _

            [policy_effect]
            e = some(where (p.eft == allow)) && !some(where (p.eft == deny))

            [matchers]
            m = g(r.sub, p.sub) && r.obj == p.obj && r.act == p.act
            """;

    public static final String PRIORITY = """
            [request_definition]
            r = sub, obj, act

            [policy_definition]
            p = priority, sub, obj, act, eft

            [role_definition]
            g = _, _

            [policy_effect]
            e = priority(p.eft) || deny

            [matchers]
            m = g(r.sub, p.sub) && r.obj == p.obj && r.act == p.act
            """;

    public static final String ALLOW_BY_DEFAULT = """
            [request_definition]
            r = sub, obj, act

            [policy_definition]
            p = sub, obj, act, eft

            [policy_effect]
            e = !some(where (p.eft == deny))

            [matchers]
            m = r.sub == p.sub && r.obj == p.obj && r.act == p.act
            """;

    public static final String KEY_MATCH = """
            [request_definition]
            r = sub, obj, act

            [policy_definition]
            p = sub, obj, act

            [policy_effect]
            e = some(where (p.eft == allow))

            [matchers]
            m = r.sub == p.sub && keyMatch2(r.obj, p.obj) && regexMatch(r.act, p.act)
            """;

    public static final String ABAC_RULE = """
            [request_definition]
            r = sub, obj, act

            [policy_definition]
            p = sub_rule, obj, act

            [policy_effect]
            e = some(where (p.eft == allow))

            [matchers]
            m = eval(p.sub_rule) && r.obj == p.obj && r.act == p.act
            """;

    private TestModels() {}
}
