/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core;

import java.util.Optional;

/**
 * A lookup result tied to the index generation it was computed against.
 * A cached entry from an older generation is never served.
 */
public final class CachedLookup {
    private final long generation;
    private final String network;

    public CachedLookup(long generation, String network) {
        this.generation = generation;
        this.network = network;
    }

    public long getGeneration() { return generation; }

    public Optional<String> getNetwork() {
        return Optional.ofNullable(network);
    }

    @Override
    public String toString() {
        return "CachedLookup{generation=" + generation + ", network=" + network + '}';
    }
}
