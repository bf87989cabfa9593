package bouncer.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bouncer.adapter.in.dto.DecisionDto;
import bouncer.adapter.in.dto.DecisionRequest;
import bouncer.adapter.in.dto.MutationResultDto;
import bouncer.adapter.in.dto.PolicyRuleRequest;
import bouncer.adapter.in.dto.PolicySetDto;
import bouncer.adapter.in.dto.StorageResultDto;
import bouncer.core.model.definition.CompiledModel;
import bouncer.core.port.in.AccessEnforcement;
import bouncer.core.port.in.PolicyManagement;

/**
 * REST resource for policy administration.
 *
 * <p>Every mutation is applied atomically by the enforcer; invalid rules are
 * answered with 400 and leave the policy untouched.
 */
@Path("/admin/policies")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class PolicyResource {

    private static final Logger LOG = Logger.getLogger(PolicyResource.class);

    private final PolicyManagement policies;
    private final AccessEnforcement enforcement;

    @Inject
    public PolicyResource(PolicyManagement policies, AccessEnforcement enforcement) {
        this.policies = policies;
        this.enforcement = enforcement;
    }

    /**
     * List all policy rules and role assignments.
     */
    @GET
    public PolicySetDto listPolicies() {
        return new PolicySetDto(policies.getPolicy(), policies.getGroupingPolicy());
    }

    /**
     * Add one rule.
     *
     * @return 201 Created if the rule is new, 200 OK if it already existed
     */
    @POST
    public Response addRule(@Valid @NotNull PolicyRuleRequest request) {
        final var section = request.sectionOrDefault();
        final var values = request.values().toArray(String[]::new);
        final var changed = CompiledModel.POLICY_KEY.equals(section)
                ? policies.addPolicy(values)
                : policies.addNamedGroupingPolicy(section, values);
        LOG.infof("Add rule %s %s: %s", section, request.values(), changed ? "added" : "already present");
        return Response.status(changed ? Response.Status.CREATED : Response.Status.OK)
                .entity(new MutationResultDto(changed))
                .build();
    }

    /**
     * Remove one rule.
     */
    @DELETE
    public MutationResultDto removeRule(@Valid @NotNull PolicyRuleRequest request) {
        final var section = request.sectionOrDefault();
        final var values = request.values().toArray(String[]::new);
        final var changed = CompiledModel.POLICY_KEY.equals(section)
                ? policies.removePolicy(values)
                : policies.removeNamedGroupingPolicy(section, values);
        LOG.infof("Remove rule %s %s: %s", section, request.values(), changed ? "removed" : "not present");
        return new MutationResultDto(changed);
    }

    /**
     * Decide a request without performing it.
     */
    @POST
    @Path("/check")
    public DecisionDto check(@Valid @NotNull DecisionRequest request) {
        return DecisionDto.fromModel(enforcement.enforceWithExplanation(request.values().toArray()));
    }

    /**
     * Replace the in-memory policy with the contents of policy storage.
     */
    @POST
    @Path("/reload")
    public Uni<StorageResultDto> reload() {
        return policies.loadPolicy().map(StorageResultDto::new);
    }

    /**
     * Write the in-memory policy to policy storage.
     */
    @POST
    @Path("/save")
    public Uni<StorageResultDto> save() {
        return policies.savePolicy().map(StorageResultDto::new);
    }
}
