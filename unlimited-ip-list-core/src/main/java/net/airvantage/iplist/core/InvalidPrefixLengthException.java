/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core;

public final class InvalidPrefixLengthException extends IpListException {
    private static final long serialVersionUID = 1L;

    public InvalidPrefixLengthException(String message, String input) {
        super(message, input);
    }
}
