package bouncer.adapter.in.http;

import java.util.List;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.ext.Provider;

import org.jboss.logging.Logger;

import bouncer.adapter.in.problem.AuthzProblem;
import bouncer.config.AuthType;
import bouncer.config.AuthzConfig;
import bouncer.core.model.PolicyEngineException;
import bouncer.core.port.in.AccessEnforcement;
import bouncer.core.port.out.DecisionMetrics;
import bouncer.core.port.out.DecisionMetrics.Outcome;

/**
 * Request filter that asks the enforcer whether the caller may perform the request.
 *
 * <p>The decision tuple is (subject, request path, HTTP method). An allowed
 * request continues, a denied one is answered with 403, and a request the
 * engine fails to decide is answered with 500.
 */
@Provider
@Priority(Priorities.AUTHORIZATION)
public class EnforcementFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(EnforcementFilter.class);
    private static final Logger AUDIT = Logger.getLogger("bouncer.audit.decision");

    private final AccessEnforcement enforcer;
    private final DecisionMetrics metrics;
    private final SubjectExtractor subjectExtractor;
    private final SkipPredicate skipPredicate;
    private final boolean enabled;

    @Inject
    public EnforcementFilter(AccessEnforcement enforcer, DecisionMetrics metrics, AuthzConfig config) {
        this(
                enforcer,
                metrics,
                extractorFor(config),
                new PathGlobSkipPredicate(config.skipPaths().orElse(List.of())),
                config.enabled());
    }

    public EnforcementFilter(
            AccessEnforcement enforcer,
            DecisionMetrics metrics,
            SubjectExtractor subjectExtractor,
            SkipPredicate skipPredicate,
            boolean enabled) {
        this.enforcer = enforcer;
        this.metrics = metrics;
        this.subjectExtractor = subjectExtractor;
        this.skipPredicate = skipPredicate;
        this.enabled = enabled;
    }

    static SubjectExtractor extractorFor(AuthzConfig config) {
        return config.authType() == AuthType.JWT
                ? new BearerClaimSubjectExtractor(config.subjectClaim())
                : new BasicSubjectExtractor();
    }

    @Override
    public void filter(ContainerRequestContext requestContext) {
        if (!enabled) {
            return;
        }

        final var path = absolute(requestContext.getUriInfo().getPath());
        final var method = requestContext.getMethod();
        if (skipPredicate.shouldSkip(path, method)) {
            LOG.debugf("Skipping enforcement for %s %s", method, path);
            metrics.recordDecision(Outcome.SKIPPED, 0);
            return;
        }

        final var subject = subjectExtractor.extract(requestContext.getHeaderString(HttpHeaders.AUTHORIZATION));
        if (subject.isEmpty() && subjectExtractor.requiresSubject()) {
            AUDIT.infof("subject=<none> object=%s action=%s decision=unauthenticated", path, method);
            requestContext.abortWith(AuthzProblem.toResponse(AuthzProblem.unauthorized("No subject in credentials")));
            return;
        }
        final var sub = subject.orElse("");

        final var start = System.nanoTime();
        final boolean allowed;
        try {
            allowed = enforcer.enforce(sub, path, method);
        } catch (PolicyEngineException e) {
            metrics.recordDecision(Outcome.ERROR, System.nanoTime() - start);
            LOG.errorf(e, "Authorization decision failed for %s %s", method, path);
            AUDIT.infof("subject=%s object=%s action=%s decision=error", sub, path, method);
            requestContext.abortWith(
                    AuthzProblem.toResponse(AuthzProblem.decisionFailed("Authorization could not be decided")));
            return;
        }

        metrics.recordDecision(allowed ? Outcome.ALLOW : Outcome.DENY, System.nanoTime() - start);
        AUDIT.infof("subject=%s object=%s action=%s decision=%s", sub, path, method, allowed ? "allow" : "deny");
        if (!allowed) {
            requestContext.abortWith(AuthzProblem.toResponse(
                    AuthzProblem.forbidden("'%s' may not %s %s".formatted(sub, method, path))));
        }
    }

    private static String absolute(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        return path.startsWith("/") ? path : "/" + path;
    }
}
