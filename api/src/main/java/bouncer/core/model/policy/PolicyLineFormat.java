package bouncer.core.model.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import bouncer.core.model.PolicyMutationException;

/**
 * Reads and writes the line-oriented policy storage format.
 *
 * <p>Each line is a comma-separated tuple whose first field is the section key:
 * <pre>
 * p, alice, /data, GET
 * g, alice, admin
 * </pre>
 *
 * <p>Whitespace around fields is trimmed. A field wrapped in double quotes may
 * contain commas, and {@code ""} inside a quoted field stands for one quote.
 * Blank lines and lines starting with {@code #} carry no rule.
 */
public final class PolicyLineFormat {

    private static final char SEPARATOR = ',';
    private static final char QUOTE = '"';

    private PolicyLineFormat() {}

    /**
     * Parse one storage line.
     *
     * @param line the raw line
     * @return the rule, or empty for blank and comment lines
     * @throws PolicyMutationException if the line is malformed
     */
    public static Optional<PolicyRule> parse(String line) {
        if (line == null) {
            return Optional.empty();
        }
        final var trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
            return Optional.empty();
        }

        final var fields = split(trimmed);
        if (fields.size() < 2) {
            throw new PolicyMutationException("Policy line has no values: " + line);
        }
        final var section = fields.get(0);
        if (section.isEmpty()) {
            throw new PolicyMutationException("Policy line has no section key: " + line);
        }
        return Optional.of(new PolicyRule(section, fields.subList(1, fields.size())));
    }

    /**
     * Parse a whole policy document.
     *
     * @param lines  the document lines
     * @param source where the lines came from, for error messages
     * @return the rules, in document order
     * @throws PolicyMutationException naming the first malformed line
     */
    public static List<PolicyRule> parseAll(List<String> lines, String source) {
        final List<PolicyRule> rules = new ArrayList<>();
        for (var i = 0; i < lines.size(); i++) {
            try {
                parse(lines.get(i)).ifPresent(rules::add);
            } catch (PolicyMutationException e) {
                throw new PolicyMutationException(source + ":" + (i + 1) + ": " + e.getMessage(), e);
            }
        }
        return rules;
    }

    /**
     * Format a rule as a storage line.
     *
     * @param rule the rule
     * @return the line, without a trailing newline
     * @throws PolicyMutationException if a value contains a line break
     */
    public static String format(PolicyRule rule) {
        final var sb = new StringBuilder(rule.section());
        for (var value : rule.values()) {
            sb.append(SEPARATOR).append(' ').append(quoteIfNeeded(value));
        }
        return sb.toString();
    }

    private static List<String> split(String line) {
        final List<String> fields = new ArrayList<>();
        final var current = new StringBuilder();
        var inQuotes = false;
        var quoted = false;

        for (var i = 0; i < line.length(); i++) {
            final var c = line.charAt(i);
            if (inQuotes) {
                if (c == QUOTE) {
                    if (i + 1 < line.length() && line.charAt(i + 1) == QUOTE) {
                        current.append(QUOTE);
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == QUOTE && current.toString().isBlank()) {
                current.setLength(0);
                inQuotes = true;
                quoted = true;
            } else if (c == SEPARATOR) {
                fields.add(quoted ? current.toString() : current.toString().trim());
                current.setLength(0);
                quoted = false;
            } else if (!quoted) {
                current.append(c);
            } else if (!Character.isWhitespace(c)) {
                throw new PolicyMutationException("Unexpected character after quoted field: " + line);
            }
        }

        if (inQuotes) {
            throw new PolicyMutationException("Unterminated quoted field: " + line);
        }
        fields.add(quoted ? current.toString() : current.toString().trim());
        return fields;
    }

    /**
     * @return whether the value can be stored on a single line
     */
    public static boolean isSingleLine(String value) {
        return value.indexOf('\n') < 0 && value.indexOf('\r') < 0;
    }

    private static String quoteIfNeeded(String value) {
        if (!isSingleLine(value)) {
            throw new PolicyMutationException("Policy value contains a line break: "
                    + value.replace("\n", "\\n").replace("\r", "\\r"));
        }
        if (value.indexOf(SEPARATOR) < 0
                && value.indexOf(QUOTE) < 0
                && value.equals(value.trim())) {
            return value;
        }
        return QUOTE + value.replace("\"", "\"\"") + QUOTE;
    }
}
