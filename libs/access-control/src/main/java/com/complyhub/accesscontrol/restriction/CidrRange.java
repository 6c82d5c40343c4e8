package com.complyhub.accesscontrol.restriction;

import java.net.InetAddress;
import java.util.Arrays;
import java.util.Optional;

/**
 * An IPv4 or IPv6 address range in CIDR notation ({@code network/prefix-bits}).
 * <p>
 * Containment keeps the first {@code prefix} bits of both addresses and compares them. A
 * range never contains an address of the other family.
 */
public final class CidrRange {

    private final byte[] network;
    private final int prefixLength;
    private final String notation;

    private CidrRange(byte[] network, int prefixLength, String notation) {
        this.network = network;
        this.prefixLength = prefixLength;
        this.notation = notation;
    }

    /**
     * Parses CIDR notation. A bare address is read as a single-host range ({@code /32} or
     * {@code /128}).
     *
     * @param value text such as {@code 10.0.0.0/8} or {@code 2001:db8::/32}
     * @return the range, or empty if the address or prefix length is invalid
     */
    public static Optional<CidrRange> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String text = value.trim();
        int slash = text.indexOf('/');
        String addressPart = slash < 0 ? text : text.substring(0, slash);

        Optional<InetAddress> address = IpAddresses.parse(addressPart);
        if (address.isEmpty()) {
            return Optional.empty();
        }
        byte[] bytes = address.get().getAddress();
        int maxPrefix = bytes.length * Byte.SIZE;

        int prefix = maxPrefix;
        if (slash >= 0) {
            String prefixPart = text.substring(slash + 1);
            if (prefixPart.isEmpty() || !prefixPart.chars().allMatch(Character::isDigit) || prefixPart.length() > 3) {
                return Optional.empty();
            }
            prefix = Integer.parseInt(prefixPart);
            if (prefix > maxPrefix) {
                return Optional.empty();
            }
        }
        return Optional.of(new CidrRange(bytes, prefix, text));
    }

    /**
     * Checks whether the address lies in this range.
     */
    public boolean contains(InetAddress address) {
        if (address == null) {
            return false;
        }
        byte[] candidate = address.getAddress();
        if (candidate.length != network.length) {
            return false;
        }
        int fullBytes = prefixLength / Byte.SIZE;
        for (int i = 0; i < fullBytes; i++) {
            if (candidate[i] != network[i]) {
                return false;
            }
        }
        int remainingBits = prefixLength % Byte.SIZE;
        if (remainingBits == 0) {
            return true;
        }
        int mask = (0xFF << (Byte.SIZE - remainingBits)) & 0xFF;
        return (candidate[fullBytes] & mask) == (network[fullBytes] & mask);
    }

    /** Parses the literal and checks containment; false for an invalid literal. */
    public boolean contains(String address) {
        return IpAddresses.parse(address).map(this::contains).orElse(false);
    }

    public int prefixLength() {
        return prefixLength;
    }

    public boolean isIpv4() {
        return network.length == 4;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CidrRange other
                && prefixLength == other.prefixLength
                && Arrays.equals(network, other.network);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(network) + prefixLength;
    }

    @Override
    public String toString() {
        return notation;
    }
}
