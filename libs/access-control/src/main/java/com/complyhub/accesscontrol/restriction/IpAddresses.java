package com.complyhub.accesscontrol.restriction;

import com.google.common.net.InetAddresses;

import java.net.InetAddress;
import java.util.Optional;

/**
 * Parsing and comparison of IPv4/IPv6 address literals.
 * <p>
 * Only literals are accepted; host names are never resolved. IPv4-mapped IPv6 literals
 * ({@code ::ffff:10.0.0.1}) are treated as the IPv4 address they carry.
 */
public final class IpAddresses {

    private IpAddresses() {
        // utility class
    }

    /**
     * Parses an address literal.
     *
     * @param literal the text to parse, surrounding whitespace and brackets allowed
     * @return the address, or empty when the text is not an IP literal
     */
    public static Optional<InetAddress> parse(String literal) {
        if (literal == null) {
            return Optional.empty();
        }
        String candidate = literal.trim();
        if (candidate.startsWith("[") && candidate.endsWith("]")) {
            candidate = candidate.substring(1, candidate.length() - 1);
        }
        if (candidate.isEmpty() || !InetAddresses.isInetAddress(candidate)) {
            return Optional.empty();
        }
        return Optional.of(InetAddresses.forString(candidate));
    }

    /**
     * Checks whether a configured address literal denotes the given address.
     * Unparsable literals never match.
     */
    public static boolean matches(String configured, InetAddress address) {
        return address != null && parse(configured).map(address::equals).orElse(false);
    }

    /**
     * Checks whether two literals denote the same address ({@code ::1} and
     * {@code 0:0:0:0:0:0:0:1} do). False when either is not a valid literal.
     */
    public static boolean sameAddress(String left, String right) {
        Optional<InetAddress> parsed = parse(left);
        return parsed.isPresent() && matches(right, parsed.get());
    }
}
