/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core;

import net.airvantage.iplist.core.address.IpAddress;

/**
 * Thread-safe cache abstraction memoizing lookup results per address.
 */
public interface LookupCache {
    void put(IpAddress address, CachedLookup lookup);
    CachedLookup get(IpAddress address);
    void invalidate(IpAddress address);
    void clear();
}
