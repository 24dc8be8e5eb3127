/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core.address;

import java.math.BigInteger;

/**
 * Address family. Each family is its own integer domain; values of different
 * families are never compared with each other.
 */
public enum IpFamily {
    IPV4(32),
    IPV6(128);

    private final int bits;
    private final BigInteger maxValue;
    private final BigInteger[] hostMasks;

    IpFamily(int bits) {
        this.bits = bits;
        this.maxValue = BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
        this.hostMasks = new BigInteger[bits + 1];
        for (int length = 0; length <= bits; length++) {
            hostMasks[length] = BigInteger.ONE.shiftLeft(bits - length).subtract(BigInteger.ONE);
        }
    }

    public int bits() { return bits; }
    public int byteLength() { return bits / 8; }
    public BigInteger maxValue() { return maxValue; }

    public boolean isValidLength(int length) {
        return length >= 0 && length <= bits;
    }

    public boolean inRange(BigInteger value) {
        return value.signum() >= 0 && value.compareTo(maxValue) <= 0;
    }

    /**
     * Low-order bits beyond {@code length}, all set.
     *
     * @throws IllegalArgumentException if length is outside [0, bits]
     */
    public BigInteger hostMask(int length) {
        if (!isValidLength(length)) {
            throw new IllegalArgumentException("Invalid prefix length " + length + " for " + this);
        }
        return hostMasks[length];
    }

    /**
     * High-order {@code length} bits set, the rest clear.
     */
    public BigInteger networkMask(int length) {
        return maxValue.xor(hostMask(length));
    }
}
