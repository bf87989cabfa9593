package bouncer.adapter.in.problem;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for authorization errors.
 *
 * <p>A denied request and a request that could not be decided get different
 * statuses, so clients never mistake an engine failure for a denial.
 */
public final class AuthzProblem {

    static final String PROBLEM_JSON = "application/problem+json";

    private AuthzProblem() {
        // Utility class - prevent instantiation
    }

    public static HttpProblem forbidden(String detail) {
        return HttpProblem.builder()
                .withTitle("Forbidden")
                .withStatus(Status.FORBIDDEN)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem unauthorized(String detail) {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem decisionFailed(String detail) {
        return HttpProblem.builder()
                .withTitle("Authorization Decision Failed")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem invalidModel(String detail) {
        return HttpProblem.builder()
                .withTitle("Invalid Model")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem storageUnavailable(String detail) {
        return HttpProblem.builder()
                .withTitle("Policy Storage Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail(detail)
                .build();
    }

    /**
     * Render a problem as a response, for filters that abort instead of throwing.
     */
    public static Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
