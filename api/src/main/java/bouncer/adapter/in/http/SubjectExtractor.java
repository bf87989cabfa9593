package bouncer.adapter.in.http;

import java.util.Optional;

/**
 * Derives the subject of a request from its {@code Authorization} header.
 *
 * <p>Extractors only read credentials that are already present. They never
 * verify them; authentication happens upstream.
 */
public interface SubjectExtractor {

    /**
     * @param authorizationHeader the raw header value, possibly null
     * @return the subject, or empty if the header carries none
     */
    Optional<String> extract(String authorizationHeader);

    /**
     * @return true if a request without a subject must be rejected before any decision
     */
    default boolean requiresSubject() {
        return false;
    }
}
