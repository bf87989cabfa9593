package bouncer.core.model.expression;

import java.math.BigDecimal;
import java.util.Objects;

import bouncer.core.model.EnforcementException;
import bouncer.core.model.definition.MatchingOptions;

/**
 * Value semantics shared by the expression nodes.
 */
final class Values {

    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    private Values() {}

    static boolean asBoolean(Object value, String operator) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new EnforcementException("Operator '" + operator + "' requires a boolean operand, got "
                + describe(value));
    }

    static boolean equal(Object left, Object right, MatchingOptions options) {
        if (left instanceof String l && right instanceof String r) {
            return options.caseSensitive() ? l.equals(r) : l.equalsIgnoreCase(r);
        }
        if (left instanceof Number l && right instanceof Number r) {
            return toDecimal(l).compareTo(toDecimal(r)) == 0;
        }
        return Objects.equals(left, right);
    }

    static int compare(Object left, Object right, String operator) {
        if (left instanceof Number l && right instanceof Number r) {
            return toDecimal(l).compareTo(toDecimal(r));
        }
        if (left instanceof String l && right instanceof String r) {
            return l.compareTo(r);
        }
        throw new EnforcementException("Operator '" + operator + "' cannot compare " + describe(left)
                + " with " + describe(right));
    }

    static Object add(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            final var sum = toDecimal(l).add(toDecimal(r));
            if (sum.stripTrailingZeros().scale() <= 0 && fitsInLong(sum)) {
                return sum.longValue();
            }
            return sum.doubleValue();
        }
        if (left instanceof String || right instanceof String) {
            return String.valueOf(left) + right;
        }
        throw new EnforcementException("Operator '+' cannot combine " + describe(left) + " with " + describe(right));
    }

    static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " '" + value + "'";
    }

    // NaN and the infinities have no decimal form and no meaningful order.
    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if ((number instanceof Double || number instanceof Float) && !Double.isFinite(number.doubleValue())) {
            throw new EnforcementException("Arithmetic on a non-finite number: " + describe(number));
        }
        try {
            return new BigDecimal(number.toString());
        } catch (NumberFormatException e) {
            throw new EnforcementException("Not a decimal number: " + describe(number), e);
        }
    }

    private static boolean fitsInLong(BigDecimal value) {
        return value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0;
    }
}
