package bouncer.core.model.policy;

import java.util.Locale;
import java.util.Optional;

/**
 * The effect a matching policy rule contributes.
 */
public enum RuleEffect {
    ALLOW("allow"),
    DENY("deny");

    private final String value;

    RuleEffect(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parse an effect value as stored in the {@code eft} policy field.
     *
     * @param raw the stored value
     * @return the effect, or empty if the value is not recognised
     */
    public static Optional<RuleEffect> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "allow" -> Optional.of(ALLOW);
            case "deny" -> Optional.of(DENY);
            default -> Optional.empty();
        };
    }
}
