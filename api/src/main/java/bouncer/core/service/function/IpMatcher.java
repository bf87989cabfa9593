package bouncer.core.service.function;

import java.net.InetAddress;
import java.net.UnknownHostException;

import bouncer.core.cache.CaffeinePatternCache;
import bouncer.core.cache.PatternCache;
import bouncer.core.model.EnforcementException;

/**
 * Backs the {@code ipMatch(ip, pattern)} function.
 *
 * <p>The pattern is either a single address or a CIDR block such as
 * {@code 192.168.2.0/24}. Both IPv4 and IPv6 are supported; an IPv4 address
 * never matches an IPv6 block. Arguments that are not IP literals are errors,
 * never silent mismatches.
 */
public class IpMatcher {

    private final PatternCache<String, ParsedCidr> cidrCache;

    public IpMatcher() {
        this(new CaffeinePatternCache<>());
    }

    IpMatcher(PatternCache<String, ParsedCidr> cidrCache) {
        this.cidrCache = cidrCache;
    }

    /**
     * Pre-parsed CIDR network for fast matching.
     */
    record ParsedCidr(byte[] networkBytes, int prefixLength) {}

    public boolean matches(String ip, String pattern) {
        final var sourceBytes = parseAddress(ip);
        final var cidr = cidrCache.get(pattern, this::parseCidr);

        final var networkBytes = cidr.networkBytes();
        final var prefixLength = cidr.prefixLength();
        if (networkBytes.length != sourceBytes.length) {
            return false;
        }

        final var fullBytes = prefixLength / 8;
        final var remainingBits = prefixLength % 8;

        for (var i = 0; i < fullBytes; i++) {
            if (networkBytes[i] != sourceBytes[i]) {
                return false;
            }
        }

        if (remainingBits > 0 && fullBytes < networkBytes.length) {
            final var mask = (byte) (0xFF << (8 - remainingBits));
            return (networkBytes[fullBytes] & mask) == (sourceBytes[fullBytes] & mask);
        }
        return true;
    }

    private ParsedCidr parseCidr(String pattern) {
        final var slash = pattern.indexOf('/');
        if (slash < 0) {
            final var bytes = parseAddress(pattern);
            return new ParsedCidr(bytes, bytes.length * 8);
        }

        final var bytes = parseAddress(pattern.substring(0, slash));
        final int prefixLength;
        try {
            prefixLength = Integer.parseInt(pattern.substring(slash + 1));
        } catch (NumberFormatException e) {
            throw new EnforcementException("ipMatch: invalid prefix length in '" + pattern + "'", e);
        }
        if (prefixLength < 0 || prefixLength > bytes.length * 8) {
            throw new EnforcementException("ipMatch: prefix length out of range in '" + pattern + "'");
        }
        return new ParsedCidr(bytes, prefixLength);
    }

    private byte[] parseAddress(String value) {
        if (!looksLikeIpLiteral(value)) {
            throw new EnforcementException("ipMatch: '" + value + "' is not an IP address");
        }
        try {
            return InetAddress.getByName(value).getAddress();
        } catch (UnknownHostException e) {
            throw new EnforcementException("ipMatch: '" + value + "' is not an IP address", e);
        }
    }

    // Keeps InetAddress from attempting a DNS lookup for host names.
    private static boolean looksLikeIpLiteral(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        if (value.indexOf(':') >= 0) {
            return value.chars().allMatch(c -> Character.digit(c, 16) >= 0 || c == ':' || c == '.');
        }
        final var parts = value.split("\\.", -1);
        if (parts.length != 4) {
            return false;
        }
        for (var part : parts) {
            if (part.isEmpty() || part.length() > 3 || !part.chars().allMatch(Character::isDigit)) {
                return false;
            }
            if (Integer.parseInt(part) > 255) {
                return false;
            }
        }
        return true;
    }
}
