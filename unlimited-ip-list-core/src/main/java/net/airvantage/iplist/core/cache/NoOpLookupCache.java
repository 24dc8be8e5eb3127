/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core.cache;

import net.airvantage.iplist.core.CachedLookup;
import net.airvantage.iplist.core.LookupCache;
import net.airvantage.iplist.core.address.IpAddress;

/**
 * No-op implementation; every lookup goes to the index.
 */
public final class NoOpLookupCache implements LookupCache {
    public static final NoOpLookupCache INSTANCE = new NoOpLookupCache();

    @Override
    public void put(IpAddress address, CachedLookup lookup) { }

    @Override
    public CachedLookup get(IpAddress address) { return null; }

    @Override
    public void invalidate(IpAddress address) { }

    @Override
    public void clear() { }
}
