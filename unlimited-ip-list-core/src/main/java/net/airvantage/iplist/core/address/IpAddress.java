/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core.address;

import java.math.BigInteger;
import java.util.Objects;

/**
 * An address as an unsigned integer tagged with its family.
 * Instances are immutable; {@link #toString()} gives the canonical text.
 */
public final class IpAddress implements Comparable<IpAddress> {
    private final IpFamily family;
    private final BigInteger value;

    IpAddress(IpFamily family, BigInteger value) {
        this.family = family;
        this.value = value;
    }

    public IpFamily getFamily() { return family; }
    public BigInteger getValue() { return value; }

    @Override
    public int compareTo(IpAddress other) {
        int byFamily = family.compareTo(other.family);
        return byFamily != 0 ? byFamily : value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IpAddress)) return false;
        IpAddress that = (IpAddress) o;
        return family == that.family && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, value);
    }

    @Override
    public String toString() {
        return IpAddresses.format(value, family);
    }
}
