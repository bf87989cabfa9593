package bouncer.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import bouncer.core.model.EnforcementException;
import bouncer.core.model.ModelCompileException;
import bouncer.core.model.PolicyMutationException;
import bouncer.spi.StorageProviderException;

/**
 * Global exception mappers for converting engine exceptions to RFC 7807 Problem Details.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);

    @ServerExceptionMapper
    public Response mapPolicyMutationException(PolicyMutationException e) {
        LOG.debugv("Rejected policy mutation: {0}", e.getMessage());
        return AuthzProblem.toResponse(AuthzProblem.badRequest(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapModelCompileException(ModelCompileException e) {
        LOG.debugv("Rejected model: {0}", e.getMessage());
        return AuthzProblem.toResponse(AuthzProblem.invalidModel(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapEnforcementException(EnforcementException e) {
        LOG.warnv("Decision failed: {0}", e.getMessage());
        return AuthzProblem.toResponse(AuthzProblem.decisionFailed(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapStorageProviderException(StorageProviderException e) {
        LOG.errorv(e, "Policy storage unavailable: {0}", e.getMessage());
        return AuthzProblem.toResponse(AuthzProblem.storageUnavailable(e.getMessage()));
    }
}
