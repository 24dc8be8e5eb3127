/**
 * BSD-3-Clause License.
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core.address;

import com.google.common.net.InetAddresses;
import net.airvantage.iplist.core.InvalidAddressException;

import java.math.BigInteger;
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Conversions between address text, unsigned integers and canonical text.
 *
 * <p>Parsing goes through Guava's {@link InetAddresses#forString(String)}, so a
 * hostname is rejected instead of being resolved. The family is decided by the
 * syntax of the text: anything containing a colon is IPv6, including the
 * IPv4-mapped {@code ::ffff:a.b.c.d} form that the JDK would otherwise turn
 * into an IPv4 address.
 */
public final class IpAddresses {
    private IpAddresses() {}

    private static final int IPV6_GROUPS = 8;
    private static final byte[] IPV4_MAPPED_PREFIX = new byte[] {
        0, 0, 0, 0, 0, 0, 0, 0, 0, 0, (byte) 0xFF, (byte) 0xFF
    };

    /**
     * Parses a dotted-quad IPv4 or a colon-hex IPv6 address.
     *
     * @param text the address text, surrounding whitespace ignored
     * @return the parsed address
     * @throws InvalidAddressException if the text is not an IP literal
     */
    public static IpAddress parse(String text) throws InvalidAddressException {
        if (text == null) {
            throw new InvalidAddressException("Address cannot be null", null);
        }
        String literal = text.strip();
        if (literal.isEmpty()) {
            throw new InvalidAddressException("Address cannot be empty", text);
        }
        if (literal.indexOf('%') >= 0) {
            throw new InvalidAddressException("Scoped addresses are not supported: " + literal, text);
        }

        InetAddress inet;
        try {
            inet = InetAddresses.forString(literal);
        } catch (IllegalArgumentException e) {
            throw new InvalidAddressException("Invalid IP address: " + literal, text, e);
        }

        byte[] raw = inet.getAddress();
        IpFamily family = literal.indexOf(':') >= 0 ? IpFamily.IPV6 : IpFamily.IPV4;
        if (family == IpFamily.IPV6 && raw.length == IpFamily.IPV4.byteLength()) {
            raw = toMappedBytes(raw);
        }
        return new IpAddress(family, new BigInteger(1, raw));
    }

    public static boolean isValid(String text) {
        try {
            parse(text);
            return true;
        } catch (InvalidAddressException e) {
            return false;
        }
    }

    public static boolean isValid(BigInteger value) {
        return value != null && IpFamily.IPV6.inRange(value);
    }

    public static BigInteger toInteger(String text) throws InvalidAddressException {
        return parse(text).getValue();
    }

    /**
     * Builds an address of the given family from its integer value.
     *
     * @throws InvalidAddressException if the value is outside [0, 2^bits - 1]
     */
    public static IpAddress fromInteger(BigInteger value, IpFamily family) throws InvalidAddressException {
        if (value == null || !family.inRange(value)) {
            throw new InvalidAddressException("Integer out of range for " + family + ": " + value, String.valueOf(value));
        }
        return new IpAddress(family, value);
    }

    /**
     * Builds an address from its integer value, inferring the family:
     * values up to 2^32 - 1 are IPv4, larger values are IPv6.
     */
    public static IpAddress fromInteger(BigInteger value) throws InvalidAddressException {
        if (value != null && IpFamily.IPV4.inRange(value)) {
            return new IpAddress(IpFamily.IPV4, value);
        }
        return fromInteger(value, IpFamily.IPV6);
    }

    public static IpAddress fromInetAddress(InetAddress address) {
        if (address instanceof Inet4Address) {
            return new IpAddress(IpFamily.IPV4, new BigInteger(1, address.getAddress()));
        }
        if (address instanceof Inet6Address) {
            return new IpAddress(IpFamily.IPV6, new BigInteger(1, address.getAddress()));
        }
        throw new InvalidAddressException("Unsupported address type: " + address, String.valueOf(address));
    }

    /**
     * Converts an address to its {@code java.net} form. An IPv4-mapped IPv6
     * address stays an {@link Inet6Address}.
     */
    public static InetAddress toInetAddress(IpAddress address) {
        IpFamily family = address.getFamily();
        byte[] raw = toBytes(address.getValue(), family.byteLength());
        try {
            if (family == IpFamily.IPV6) {
                return Inet6Address.getByAddress(null, raw, -1);
            }
            return InetAddress.getByAddress(raw);
        } catch (UnknownHostException e) {
            // only thrown for an illegal byte length
            throw new IllegalStateException("Unexpected address length " + raw.length, e);
        }
    }

    private static byte[] toBytes(BigInteger value, int length) {
        byte[] signed = value.toByteArray();
        byte[] raw = new byte[length];
        int copy = Math.min(signed.length, length);
        System.arraycopy(signed, signed.length - copy, raw, length - copy, copy);
        return raw;
    }

    /**
     * Canonical text of an address: dotted quad for IPv4; for IPv6 lower-case
     * hex groups without leading zeros, the longest run of two or more zero
     * groups (the first one on ties) collapsed to {@code ::}.
     *
     * @throws InvalidAddressException if the value is outside the family range
     */
    public static String format(BigInteger value, IpFamily family) throws InvalidAddressException {
        if (value == null || !family.inRange(value)) {
            throw new InvalidAddressException("Integer out of range for " + family + ": " + value, String.valueOf(value));
        }
        return family == IpFamily.IPV4 ? formatIPv4(value.intValue()) : formatIPv6(value);
    }

    private static String formatIPv4(int bits) {
        return ((bits >>> 24) & 0xFF) + "." + ((bits >>> 16) & 0xFF) + "." + ((bits >>> 8) & 0xFF) + "." + (bits & 0xFF);
    }

    private static String formatIPv6(BigInteger value) {
        int[] groups = new int[IPV6_GROUPS];
        for (int i = 0; i < IPV6_GROUPS; i++) {
            groups[i] = value.shiftRight(16 * (IPV6_GROUPS - 1 - i)).intValue() & 0xFFFF;
        }

        int bestStart = -1;
        int bestLen = 0;
        int runStart = -1;
        for (int i = 0; i <= IPV6_GROUPS; i++) {
            if (i < IPV6_GROUPS && groups[i] == 0) {
                if (runStart < 0) runStart = i;
            } else if (runStart >= 0) {
                int runLen = i - runStart;
                if (runLen > bestLen) {
                    bestStart = runStart;
                    bestLen = runLen;
                }
                runStart = -1;
            }
        }
        if (bestLen < 2) {
            bestStart = -1;
        }

        StringBuilder sb = new StringBuilder(39);
        for (int i = 0; i < IPV6_GROUPS; i++) {
            if (i == bestStart) {
                sb.append("::");
                i += bestLen - 1;
                continue;
            }
            if (sb.length() > 0 && sb.charAt(sb.length() - 1) != ':') {
                sb.append(':');
            }
            sb.append(Integer.toHexString(groups[i]));
        }
        return sb.toString();
    }

    private static byte[] toMappedBytes(byte[] ipv4) {
        byte[] mapped = new byte[IpFamily.IPV6.byteLength()];
        System.arraycopy(IPV4_MAPPED_PREFIX, 0, mapped, 0, IPV4_MAPPED_PREFIX.length);
        System.arraycopy(ipv4, 0, mapped, IPV4_MAPPED_PREFIX.length, ipv4.length);
        return mapped;
    }
}
