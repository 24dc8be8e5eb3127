/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core;

public class InvalidCidrSyntaxException extends IpListException {
    private static final long serialVersionUID = 1L;

    public InvalidCidrSyntaxException(String message, String input) {
        super(message, input);
    }
}
