/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core;

import java.util.Objects;

/**
 * An input rejected by a mutating call.
 */
public final class DiscardedEntry {
    public enum Cause {
        /** Unparsable, bad length, or host bits set with normalization off. */
        INVALID,
        /** Valid, but a duplicate of or contained in a kept prefix. */
        REDUNDANT
    }

    private final String input;
    private final Cause cause;
    private final String detail;

    public DiscardedEntry(String input, Cause cause, String detail) {
        this.input = input;
        this.cause = Objects.requireNonNull(cause, "cause");
        this.detail = detail;
    }

    public String getInput() { return input; }
    public Cause getCause() { return cause; }
    public String getDetail() { return detail; }

    public boolean isInvalid() { return cause == Cause.INVALID; }
    public boolean isRedundant() { return cause == Cause.REDUNDANT; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiscardedEntry)) return false;
        DiscardedEntry that = (DiscardedEntry) o;
        return Objects.equals(input, that.input) && cause == that.cause && Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(input, cause, detail);
    }

    @Override
    public String toString() {
        return input + " (" + cause + (detail != null ? ": " + detail : "") + ")";
    }
}
