/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core;

/**
 * Raised for a CIDR whose address has bits set beyond the prefix length
 * (e.g. {@code 10.10.10.10/8}) while normalization is disabled.
 */
public final class HostBitsSetException extends InvalidCidrSyntaxException {
    private static final long serialVersionUID = 1L;

    public HostBitsSetException(String message, String input) {
        super(message, input);
    }
}
