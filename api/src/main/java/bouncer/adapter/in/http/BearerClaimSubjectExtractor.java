package bouncer.adapter.in.http;

import java.util.Locale;
import java.util.Optional;

import org.jboss.logging.Logger;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;

/**
 * Takes the subject from a claim of an {@code Authorization: Bearer} JWT.
 *
 * <p>Only the payload is read. Signature and expiry are checked by whatever
 * authenticated the request before it got here.
 */
public class BearerClaimSubjectExtractor implements SubjectExtractor {

    private static final Logger LOG = Logger.getLogger(BearerClaimSubjectExtractor.class);
    private static final String PREFIX = "bearer ";

    private final String claim;
    private final JwtConsumer consumer;

    public BearerClaimSubjectExtractor(String claim) {
        this.claim = claim;
        // Build a consumer that skips all validation - we just want to read claims
        this.consumer = new JwtConsumerBuilder()
                .setSkipSignatureVerification()
                .setSkipAllValidators()
                .setDisableRequireSignature()
                .setSkipAllDefaultValidators()
                .build();
    }

    @Override
    public Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null
                || !authorizationHeader.toLowerCase(Locale.ROOT).startsWith(PREFIX)) {
            return Optional.empty();
        }
        final var token = authorizationHeader.substring(PREFIX.length()).trim();
        try {
            final var value = consumer.processToClaims(token).getClaimValue(claim);
            if (value == null) {
                LOG.debugf("Bearer token has no '%s' claim", claim);
                return Optional.empty();
            }
            return Optional.of(value.toString());
        } catch (InvalidJwtException e) {
            LOG.debugf("Ignoring unreadable bearer token: %s", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean requiresSubject() {
        return true;
    }
}
