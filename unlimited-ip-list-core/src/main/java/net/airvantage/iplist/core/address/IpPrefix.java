/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core.address;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A network prefix with its host bits clear, covering [start, end].
 *
 * <p>Ordered by start, then by length, so that at an equal start the broader
 * network comes first. Thread-safety: immutable.
 */
public final class IpPrefix implements Comparable<IpPrefix> {
    private final IpFamily family;
    private final BigInteger start;
    private final int length;
    private final BigInteger end;
    private final String text;

    private IpPrefix(IpFamily family, BigInteger start, int length) {
        this.family = family;
        this.start = start;
        this.length = length;
        this.end = start.or(family.hostMask(length));
        this.text = IpAddresses.format(start, family) + "/" + length;
    }

    /**
     * @throws IllegalArgumentException if the start is out of range, the length
     *         is invalid for the family or host bits are set
     */
    public static IpPrefix of(IpFamily family, BigInteger start, int length) {
        Objects.requireNonNull(family, "family");
        Objects.requireNonNull(start, "start");
        if (!family.inRange(start)) {
            throw new IllegalArgumentException("Start out of range for " + family + ": " + start);
        }
        if (start.and(family.hostMask(length)).signum() != 0) {
            throw new IllegalArgumentException("Host bits set in " + IpAddresses.format(start, family) + "/" + length);
        }
        return new IpPrefix(family, start, length);
    }

    public IpFamily getFamily() { return family; }
    public BigInteger getStart() { return start; }
    public BigInteger getEnd() { return end; }
    public int getLength() { return length; }

    public IpAddress getNetworkAddress() {
        return new IpAddress(family, start);
    }

    public boolean contains(IpAddress address) {
        return address.getFamily() == family && contains(address.getValue());
    }

    /**
     * Range test on the raw value; the caller is responsible for the family.
     */
    public boolean contains(BigInteger value) {
        return start.compareTo(value) <= 0 && value.compareTo(end) <= 0;
    }

    public boolean covers(IpPrefix other) {
        return family == other.family && length <= other.length && contains(other.start);
    }

    @Override
    public int compareTo(IpPrefix other) {
        int c = family.compareTo(other.family);
        if (c != 0) return c;
        c = start.compareTo(other.start);
        return c != 0 ? c : Integer.compare(length, other.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IpPrefix)) return false;
        IpPrefix that = (IpPrefix) o;
        return family == that.family && length == that.length && start.equals(that.start);
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, start, length);
    }

    @Override
    public String toString() {
        return text;
    }
}
