package com.sparrowlogic.networktopology.analysis;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * An IPv4 or IPv6 network. Host bits below the prefix are cleared on parse, so {@code 10.0.0.5/8}
 * is read as {@code 10.0.0.0/8}; an address without a prefix is a single-host network.
 */
public final class Cidr {

    private static final Pattern IPV4 = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");
    private static final Pattern IPV6 = Pattern.compile("[0-9a-fA-F:.]*:[0-9a-fA-F:.]*");
    private static final Pattern PREFIX = Pattern.compile("\\d{1,3}");

    private final byte[] network;
    private final int prefixLength;

    private Cidr(byte[] network, int prefixLength) {
        this.network = network;
        this.prefixLength = prefixLength;
    }

    /**
     * Parses {@code address[/prefix]}. Anything else, including host names, yields empty; no name
     * resolution ever takes place.
     */
    public static Optional<Cidr> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        var slash = text.indexOf('/');
        var address = slash < 0 ? text.trim() : text.substring(0, slash).trim();
        var prefix = slash < 0 ? null : text.substring(slash + 1).trim();

        var ipv4 = IPV4.matcher(address).matches();
        if (!ipv4 && !IPV6.matcher(address).matches()) {
            return Optional.empty();
        }
        // Out of range octets would otherwise be handed to the resolver as a host name.
        if (ipv4 && Arrays.stream(address.split("\\.")).anyMatch(Cidr::invalidOctet)) {
            return Optional.empty();
        }
        byte[] bytes;
        try {
            bytes = InetAddress.getByName(address).getAddress();
        } catch (UnknownHostException e) {
            return Optional.empty();
        }

        var maxBits = bytes.length * 8;
        var length = maxBits;
        if (prefix != null) {
            if (!PREFIX.matcher(prefix).matches()) {
                return Optional.empty();
            }
            length = Integer.parseInt(prefix);
            if (length > maxBits) {
                return Optional.empty();
            }
        }
        return Optional.of(new Cidr(mask(bytes, length), length));
    }

    /**
     * Leading zeros are ambiguous (octal in some parsers), so {@code 010} is rejected like {@code 256}.
     */
    private static boolean invalidOctet(String octet) {
        return (octet.length() > 1 && octet.charAt(0) == '0') || Integer.parseInt(octet) > 255;
    }

    public boolean isIpv6() {
        return network.length == 16;
    }

    public int prefixLength() {
        return prefixLength;
    }

    /**
     * True when {@code other} lies inside this network (or equals it). Networks of different
     * address families never contain each other.
     */
    public boolean contains(Cidr other) {
        if (network.length != other.network.length || other.prefixLength < prefixLength) {
            return false;
        }
        return Arrays.equals(network, mask(other.network, prefixLength));
    }

    public boolean overlaps(Cidr other) {
        return contains(other) || other.contains(this);
    }

    public boolean sameFamily(Cidr other) {
        return network.length == other.network.length;
    }

    private static byte[] mask(byte[] address, int length) {
        var masked = address.clone();
        for (var i = 0; i < masked.length; i++) {
            var bitsInByte = Math.max(0, Math.min(8, length - i * 8));
            masked[i] = (byte) (masked[i] & (0xFF << (8 - bitsInByte)));
        }
        return masked;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cidr other)) return false;
        return prefixLength == other.prefixLength && Arrays.equals(network, other.network);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(network) + prefixLength;
    }

    @Override
    public String toString() {
        try {
            return InetAddress.getByAddress(network).getHostAddress() + "/" + prefixLength;
        } catch (UnknownHostException e) {
            throw new IllegalStateException("Invalid address length " + network.length, e);
        }
    }
}
