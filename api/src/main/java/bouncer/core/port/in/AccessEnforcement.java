package bouncer.core.port.in;

import bouncer.core.model.policy.EnforcementResult;

/**
 * Port for access decisions.
 *
 * <p>Decisions are synchronous, never block on I/O, and are safe to request
 * from any number of threads at once.
 */
public interface AccessEnforcement {

    /**
     * Decide whether a request is allowed.
     *
     * @param requestValues values bound in order to the model's request definition
     * @return true if allowed, false if denied
     * @throws bouncer.core.model.EnforcementException if the arity is wrong, a value is null, or the matcher fails
     */
    boolean enforce(Object... requestValues);

    /**
     * Decide a request and report the rule that produced the decision.
     *
     * @param requestValues values bound in order to the model's request definition
     * @return the decision with its explaining rule, if any
     * @throws bouncer.core.model.EnforcementException on the same conditions as {@link #enforce}
     */
    EnforcementResult enforceWithExplanation(Object... requestValues);
}
