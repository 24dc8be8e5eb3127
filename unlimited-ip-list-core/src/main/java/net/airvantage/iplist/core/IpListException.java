/**
 * BSD-3-Clause License.
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core;

/**
 * Base class of the failures raised for malformed or unknown input.
 * Carries the offending input string as given by the caller.
 */
public class IpListException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final String input;

    public IpListException(String message, String input) {
        super(message);
        this.input = input;
    }
    public IpListException(String message, String input, Throwable cause) {
        super(message, cause);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
