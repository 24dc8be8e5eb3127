/**
 * BSD-3-Clause License.
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core;

import net.airvantage.iplist.core.address.IpAddress;
import net.airvantage.iplist.core.address.IpFamily;

/**
 * Metrics/observability callbacks for list lookups and rebuilds.
 * Implementations must be thread-safe.
 */
public interface IpListMetricsListener {
    default void onMatch(IpAddress address, String network) {}
    default void onMiss(IpAddress address) {}
    default void onInvalidInput(String input, IpListException e) {}
    default void onCacheHit(IpAddress address) {}
    default void onCacheMiss(IpAddress address) {}
    default void onRebuild(IpFamily family, int size, int chunkCount) {}
    default void onDiscarded(DiscardedEntry entry) {}
}
