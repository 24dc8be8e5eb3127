/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.guava;

import net.airvantage.iplist.core.CachedLookup;
import net.airvantage.iplist.core.LookupCache;
import net.airvantage.iplist.core.address.IpAddress;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import java.time.Duration;

/**
 * Bounded lookup cache with optional expiry after access.
 */
public final class GuavaLookupCache implements LookupCache {
    private final Cache<IpAddress, CachedLookup> cache;

    public GuavaLookupCache(long maxSize, Duration ttl) {
        CacheBuilder<Object, Object> builder = CacheBuilder.newBuilder().maximumSize(maxSize);
        if (ttl != null && !ttl.isNegative() && !ttl.isZero()) {
            builder = builder.expireAfterAccess(ttl);
        }
        this.cache = builder.build();
    }

    @Override
    public void put(IpAddress address, CachedLookup lookup) {
        if (address == null || lookup == null) return;
        cache.put(address, lookup);
    }

    @Override
    public CachedLookup get(IpAddress address) {
        if (address == null) return null;
        return cache.getIfPresent(address);
    }

    @Override
    public void invalidate(IpAddress address) {
        if (address == null) return;
        cache.invalidate(address);
    }

    @Override
    public void clear() {
        cache.invalidateAll();
    }

    public long size() {
        return cache.size();
    }
}
