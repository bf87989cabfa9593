package bouncer.core.model;

/**
 * Thrown when model text cannot be compiled.
 *
 * <p>Covers unknown sections, malformed matcher syntax, references to
 * undeclared fields and unknown functions. The previously compiled model,
 * if any, stays active.
 */
public class ModelCompileException extends PolicyEngineException {

    private final String section;

    public ModelCompileException(String section, String message) {
        super(section == null ? message : "[" + section + "] " + message);
        this.section = section;
    }

    public ModelCompileException(String section, String message, Throwable cause) {
        super(section == null ? message : "[" + section + "] " + message, cause);
        this.section = section;
    }

    /**
     * @return the model section that failed, or null when the failure is not tied to one
     */
    public String section() {
        return section;
    }
}
