package bouncer.core.model;

/**
 * Thrown when a request cannot be evaluated.
 *
 * <p>Raised for request arity mismatches, null request values and type or
 * function errors inside the matcher.
 */
public class EnforcementException extends PolicyEngineException {

    public EnforcementException(String message) {
        super(message);
    }

    public EnforcementException(String message, Throwable cause) {
        super(message, cause);
    }
}
