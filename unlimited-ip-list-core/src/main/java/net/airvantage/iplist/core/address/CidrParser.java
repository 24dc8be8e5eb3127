/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core.address;

import com.google.common.base.Splitter;
import com.google.common.primitives.Ints;
import net.airvantage.iplist.core.HostBitsSetException;
import net.airvantage.iplist.core.InvalidAddressException;
import net.airvantage.iplist.core.InvalidCidrSyntaxException;
import net.airvantage.iplist.core.InvalidPrefixLengthException;
import net.airvantage.iplist.core.IpListException;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Validates {@code address} or {@code address/length} text and turns it into an
 * {@link IpPrefix}. A missing length means a host prefix (/32 or /128).
 *
 * <p>When {@code normalize} is true, an address with host bits set is rewritten
 * to its network address ({@code 10.10.10.10/8 -> 10.0.0.0/8}); otherwise such
 * input is rejected with {@link HostBitsSetException}.
 */
public final class CidrParser {
    private CidrParser() {}

    private static final Splitter CIDR_SPLITTER = Splitter.on('/').trimResults();

    public static IpPrefix parse(String text, boolean normalize) throws IpListException {
        if (text == null) {
            throw new InvalidCidrSyntaxException("CIDR notation cannot be null", null);
        }
        String cidr = text.strip();
        if (cidr.isEmpty()) {
            throw new InvalidCidrSyntaxException("CIDR notation cannot be empty", text);
        }

        List<String> parts = CIDR_SPLITTER.splitToList(cidr);
        if (parts.size() > 2) {
            throw new InvalidCidrSyntaxException("Invalid CIDR notation: more than one '/' separator", text);
        }

        Integer length = null;
        if (parts.size() == 2) {
            length = Ints.tryParse(parts.get(1));
            if (length == null) {
                throw new InvalidCidrSyntaxException("Invalid prefix length: '" + parts.get(1) + "'", text);
            }
        }

        IpAddress address;
        try {
            address = IpAddresses.parse(parts.get(0));
        } catch (InvalidAddressException e) {
            throw new InvalidAddressException(e.getMessage(), text, e);
        }

        IpFamily family = address.getFamily();
        int prefixLength = length != null ? length : family.bits();
        if (!family.isValidLength(prefixLength)) {
            throw new InvalidPrefixLengthException(
                "Invalid prefix length " + prefixLength + " for " + family + " (must be 0-" + family.bits() + ")", text);
        }

        BigInteger base = address.getValue();
        BigInteger hostMask = family.hostMask(prefixLength);
        if (base.and(hostMask).signum() != 0) {
            if (!normalize) {
                throw new HostBitsSetException("Host bits set in " + cidr, text);
            }
            base = base.andNot(hostMask);
        }
        return IpPrefix.of(family, base, prefixLength);
    }

    /**
     * @param strict when true, requires an explicit length and clear host bits;
     *               when false, only requires a well-formed address and length
     */
    public static boolean isValidCidr(String text, boolean strict) {
        if (text == null || (strict && text.indexOf('/') < 0)) {
            return false;
        }
        try {
            parse(text, !strict);
            return true;
        } catch (IpListException e) {
            return false;
        }
    }

    /**
     * Canonical CIDR text for the input, or empty if it cannot be accepted.
     * Without normalization an explicit length and clear host bits are required.
     */
    public static Optional<String> toValidCidr(String text, boolean normalize) {
        if (text == null || (!normalize && text.indexOf('/') < 0)) {
            return Optional.empty();
        }
        try {
            return Optional.of(parse(text, normalize).toString());
        } catch (IpListException e) {
            return Optional.empty();
        }
    }
}
