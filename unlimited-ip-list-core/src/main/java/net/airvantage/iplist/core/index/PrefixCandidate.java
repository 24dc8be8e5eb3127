/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core.index;

import net.airvantage.iplist.core.address.IpPrefix;

import java.util.Objects;

/**
 * A prefix entering a build, with the text it came from. Entries already
 * stored in the list are marked {@code existing} and use their canonical text.
 */
public record PrefixCandidate(String source, IpPrefix prefix, boolean existing) {

    public PrefixCandidate {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(prefix, "prefix");
    }

    public static PrefixCandidate of(String source, IpPrefix prefix) {
        return new PrefixCandidate(source, prefix, false);
    }

    public static PrefixCandidate existing(IpPrefix prefix) {
        return new PrefixCandidate(prefix.toString(), prefix, true);
    }
}
