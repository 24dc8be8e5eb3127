/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core;

import net.airvantage.iplist.core.address.IpFamily;
import net.airvantage.iplist.core.address.IpPrefix;
import net.airvantage.iplist.core.index.ChunkIndex;

import java.util.ArrayList;
import java.util.List;

/**
 * The published state of a list: one chunk index per family and the
 * generation it was built at. Never modified after publication.
 */
final class IndexSnapshot {
    private final long generation;
    private final ChunkIndex ipv4;
    private final ChunkIndex ipv6;

    IndexSnapshot(long generation, ChunkIndex ipv4, ChunkIndex ipv6) {
        this.generation = generation;
        this.ipv4 = ipv4;
        this.ipv6 = ipv6;
    }

    static IndexSnapshot empty(long generation) {
        return new IndexSnapshot(generation, ChunkIndex.empty(IpFamily.IPV4), ChunkIndex.empty(IpFamily.IPV6));
    }

    long generation() { return generation; }

    ChunkIndex index(IpFamily family) {
        return family == IpFamily.IPV4 ? ipv4 : ipv6;
    }

    int size() {
        return ipv4.size() + ipv6.size();
    }

    /** IPv4 entries first, then IPv6, each in canonical order. */
    List<IpPrefix> prefixes() {
        List<IpPrefix> all = new ArrayList<>(size());
        all.addAll(ipv4.getPrefixes());
        all.addAll(ipv6.getPrefixes());
        return all;
    }

    IpPrefix get(int index) {
        int v4 = ipv4.size();
        return index < v4 ? ipv4.getPrefixes().get(index) : ipv6.getPrefixes().get(index - v4);
    }
}
