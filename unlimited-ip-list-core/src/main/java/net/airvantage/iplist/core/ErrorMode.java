/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core;

/**
 * How malformed input is handled by the list operations.
 */
public enum ErrorMode {
    /** Record the input as discarded (mutations) or answer not-found (lookups). */
    DISCARD,
    /** Throw the matching {@link IpListException} and leave the list untouched. */
    RAISE
}
