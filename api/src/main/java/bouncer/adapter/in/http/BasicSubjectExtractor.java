package bouncer.adapter.in.http;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;
import java.util.Optional;

import org.jboss.logging.Logger;

/**
 * Takes the user name from an {@code Authorization: Basic} header.
 *
 * <p>The password is ignored. A missing or malformed header yields no subject,
 * and the filter then decides for the empty subject.
 */
public class BasicSubjectExtractor implements SubjectExtractor {

    private static final Logger LOG = Logger.getLogger(BasicSubjectExtractor.class);
    private static final String PREFIX = "basic ";

    @Override
    public Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null
                || !authorizationHeader.toLowerCase(Locale.ROOT).startsWith(PREFIX)) {
            return Optional.empty();
        }
        final var encoded = authorizationHeader.substring(PREFIX.length()).trim();
        final String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            LOG.debugf("Ignoring malformed basic credentials: %s", e.getMessage());
            return Optional.empty();
        }
        final var colon = decoded.indexOf(':');
        return Optional.of(colon < 0 ? decoded : decoded.substring(0, colon));
    }
}
