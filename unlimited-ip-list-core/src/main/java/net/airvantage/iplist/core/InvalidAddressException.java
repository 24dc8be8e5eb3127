/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core;

public final class InvalidAddressException extends IpListException {
    private static final long serialVersionUID = 1L;

    public InvalidAddressException(String message, String input) {
        super(message, input);
    }
    public InvalidAddressException(String message, String input, Throwable cause) {
        super(message, input, cause);
    }
}
