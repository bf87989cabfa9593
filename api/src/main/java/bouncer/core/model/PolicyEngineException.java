package bouncer.core.model;

/**
 * Base type for failures raised by the policy engine.
 *
 * <p>A failure is never a decision: callers receive either a boolean outcome
 * or one of the subclasses of this exception.
 */
public class PolicyEngineException extends RuntimeException {

    public PolicyEngineException(String message) {
        super(message);
    }

    public PolicyEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
