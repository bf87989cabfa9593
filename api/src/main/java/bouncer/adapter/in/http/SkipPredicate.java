package bouncer.adapter.in.http;

/**
 * Decides which requests bypass enforcement entirely.
 */
@FunctionalInterface
public interface SkipPredicate {

    SkipPredicate NEVER = (path, method) -> false;

    /**
     * @param path   the request path
     * @param method the HTTP method
     * @return true if the request is passed through without a decision
     */
    boolean shouldSkip(String path, String method);
}
