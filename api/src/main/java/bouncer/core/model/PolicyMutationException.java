package bouncer.core.model;

/**
 * Thrown when a policy or role mutation is rejected.
 *
 * <p>The store is left unchanged whenever this is thrown.
 */
public class PolicyMutationException extends PolicyEngineException {

    public PolicyMutationException(String message) {
        super(message);
    }

    public PolicyMutationException(String message, Throwable cause) {
        super(message, cause);
    }
}
