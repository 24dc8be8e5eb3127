/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core;

import net.airvantage.iplist.core.index.ChunkIndex;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Configuration of an {@link UnlimitedIpList}. Immutable; use {@link #builder()}.
 */
public final class IpListOptions {
    public static final IpListOptions DEFAULTS = builder().build();

    private final boolean normalizeInvalidCidr;
    private final ErrorMode errorMode;
    private final boolean verboseDiagnostics;
    private final int minChunkSize;
    private final int maxChunkSize;

    private IpListOptions(Builder b) {
        this.normalizeInvalidCidr = b.normalizeInvalidCidr;
        this.errorMode = b.errorMode;
        this.verboseDiagnostics = b.verboseDiagnostics;
        this.minChunkSize = b.minChunkSize;
        this.maxChunkSize = b.maxChunkSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .normalizeInvalidCidr(normalizeInvalidCidr)
            .errorMode(errorMode)
            .verboseDiagnostics(verboseDiagnostics)
            .chunkSizeBounds(minChunkSize, maxChunkSize);
    }

    /** Rewrite {@code 10.10.10.10/8} to {@code 10.0.0.0/8} instead of discarding it. */
    public boolean isNormalizeInvalidCidr() { return normalizeInvalidCidr; }
    public ErrorMode getErrorMode() { return errorMode; }
    public boolean isRaiseOnError() { return errorMode == ErrorMode.RAISE; }
    /** Log build steps at INFO instead of DEBUG. */
    public boolean isVerboseDiagnostics() { return verboseDiagnostics; }
    public int getMinChunkSize() { return minChunkSize; }
    public int getMaxChunkSize() { return maxChunkSize; }

    @Override
    public String toString() {
        return "IpListOptions{" +
               "normalizeInvalidCidr=" + normalizeInvalidCidr +
               ", errorMode=" + errorMode +
               ", verboseDiagnostics=" + verboseDiagnostics +
               ", minChunkSize=" + minChunkSize +
               ", maxChunkSize=" + maxChunkSize +
               '}';
    }

    public static final class Builder {
        private boolean normalizeInvalidCidr = false;
        private ErrorMode errorMode = ErrorMode.DISCARD;
        private boolean verboseDiagnostics = false;
        private int minChunkSize = ChunkIndex.DEFAULT_MIN_CHUNK_SIZE;
        private int maxChunkSize = ChunkIndex.DEFAULT_MAX_CHUNK_SIZE;

        private Builder() {}

        public Builder normalizeInvalidCidr(boolean normalize) { this.normalizeInvalidCidr = normalize; return this; }
        public Builder errorMode(ErrorMode mode) { this.errorMode = Objects.requireNonNull(mode, "errorMode"); return this; }
        public Builder raiseOnError(boolean raise) { return errorMode(raise ? ErrorMode.RAISE : ErrorMode.DISCARD); }
        public Builder verboseDiagnostics(boolean verbose) { this.verboseDiagnostics = verbose; return this; }

        public Builder chunkSizeBounds(int min, int max) {
            checkArgument(min > 0, "minChunkSize must be positive: %s", min);
            checkArgument(max >= min, "maxChunkSize (%s) must be >= minChunkSize (%s)", max, min);
            this.minChunkSize = min;
            this.maxChunkSize = max;
            return this;
        }

        public IpListOptions build() {
            return new IpListOptions(this);
        }
    }
}
