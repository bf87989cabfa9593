package bouncer.config;

import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for HTTP request authorization.
 *
 * <p>Example configuration:
 * <pre>{@code
 * bouncer.authz.auth-type=JWT
 * bouncer.authz.subject-claim=preferred_username
 * bouncer.authz.skip-paths=/q/**,/health
 * }</pre>
 */
@ConfigMapping(prefix = "bouncer.authz")
public interface AuthzConfig {

    /**
     * When disabled every request passes without a decision.
     */
    @WithDefault("true")
    boolean enabled();

    @WithName("auth-type")
    @WithDefault("BASIC")
    AuthType authType();

    /**
     * Glob patterns of request paths that bypass enforcement.
     */
    @WithName("skip-paths")
    Optional<List<String>> skipPaths();

    /**
     * The JWT claim used as subject when auth-type is JWT.
     */
    @WithName("subject-claim")
    @WithDefault("sub")
    String subjectClaim();
}
