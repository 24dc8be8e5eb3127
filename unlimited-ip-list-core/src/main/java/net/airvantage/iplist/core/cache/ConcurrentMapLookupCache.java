/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core.cache;

import net.airvantage.iplist.core.CachedLookup;
import net.airvantage.iplist.core.LookupCache;
import net.airvantage.iplist.core.address.IpAddress;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Simple thread-safe cache backed by {@link ConcurrentHashMap}. Unbounded: only
 * suited to a known, limited set of queried addresses.
 */
public final class ConcurrentMapLookupCache implements LookupCache {
    private final ConcurrentMap<IpAddress, CachedLookup> map = new ConcurrentHashMap<>();

    @Override
    public void put(IpAddress address, CachedLookup lookup) {
        if (address == null || lookup == null) return;
        map.put(address, lookup);
    }

    @Override
    public CachedLookup get(IpAddress address) {
        if (address == null) return null;
        return map.get(address);
    }

    @Override
    public void invalidate(IpAddress address) {
        if (address == null) return;
        map.remove(address);
    }

    @Override
    public void clear() {
        map.clear();
    }

    public int size() {
        return map.size();
    }
}
