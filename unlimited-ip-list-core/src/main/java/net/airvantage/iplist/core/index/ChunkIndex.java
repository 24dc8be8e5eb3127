/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core.index;

import net.airvantage.iplist.core.address.IpFamily;
import net.airvantage.iplist.core.address.IpPrefix;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Two-level binary search index over a canonical set of one family.
 *
 * <p>The set is cut into contiguous chunks of roughly {@code sqrt(n)} entries;
 * {@code bounds[i]} holds the first start of chunk {@code i}. A lookup bisects
 * the bounds, then the starts of the selected chunk, then checks a single end.
 *
 * <p>Thread-safety: immutable once built.
 */
public final class ChunkIndex {
    public static final int DEFAULT_MIN_CHUNK_SIZE = 100;
    public static final int DEFAULT_MAX_CHUNK_SIZE = 5000;

    private final IpFamily family;
    private final List<IpPrefix> prefixes;
    private final BigInteger[] bounds;
    private final Chunk[] chunks;
    private final int chunkSize;

    private static final class Chunk {
        final BigInteger[] starts;
        final BigInteger[] ends;
        final IpPrefix[] prefixes;

        Chunk(List<IpPrefix> slice) {
            int n = slice.size();
            this.starts = new BigInteger[n];
            this.ends = new BigInteger[n];
            this.prefixes = slice.toArray(new IpPrefix[0]);
            for (int i = 0; i < n; i++) {
                starts[i] = prefixes[i].getStart();
                ends[i] = prefixes[i].getEnd();
            }
        }
    }

    private ChunkIndex(IpFamily family, List<IpPrefix> prefixes, int chunkSize) {
        this.family = family;
        this.prefixes = prefixes;
        this.chunkSize = chunkSize;

        int chunkCount = chunkSize == 0 ? 0 : (prefixes.size() + chunkSize - 1) / chunkSize;
        this.bounds = new BigInteger[chunkCount];
        this.chunks = new Chunk[chunkCount];
        for (int c = 0; c < chunkCount; c++) {
            int from = c * chunkSize;
            int to = Math.min(from + chunkSize, prefixes.size());
            chunks[c] = new Chunk(prefixes.subList(from, to));
            bounds[c] = chunks[c].starts[0];
        }
    }

    public static ChunkIndex empty(IpFamily family) {
        return new ChunkIndex(family, List.of(), 0);
    }

    /**
     * @param canonical sorted, non-overlapping prefixes of {@code family}
     * @throws IllegalArgumentException if the input breaks the ordering invariant
     */
    public static ChunkIndex build(IpFamily family, List<IpPrefix> canonical, int minChunkSize, int maxChunkSize) {
        List<IpPrefix> copy = List.copyOf(canonical);
        IpPrefix previous = null;
        for (IpPrefix prefix : copy) {
            checkArgument(prefix.getFamily() == family, "Prefix %s does not belong to %s", prefix, family);
            checkArgument(previous == null || prefix.getStart().compareTo(previous.getEnd()) > 0,
                "Prefix %s overlaps or precedes %s", prefix, previous);
            previous = prefix;
        }
        return new ChunkIndex(family, copy, balancedChunkSize(copy.size(), minChunkSize, maxChunkSize));
    }

    /**
     * Chunk size for {@code n} entries: {@code n} itself up to {@code minChunkSize},
     * otherwise the smallest size whose chunk count differs from it by at most
     * one, or failing that the size minimizing that difference.
     */
    public static int balancedChunkSize(int n, int minChunkSize, int maxChunkSize) {
        checkArgument(minChunkSize > 0 && maxChunkSize >= minChunkSize,
            "Invalid chunk size bounds [%s, %s]", minChunkSize, maxChunkSize);
        if (n <= minChunkSize) {
            return n;
        }
        int best = 1;
        int bestDiff = Integer.MAX_VALUE;
        for (int size = 1; size <= maxChunkSize; size++) {
            int count = (n + size - 1) / size;
            int diff = Math.abs(size - count);
            if (diff <= 1) {
                return size;
            }
            if (diff < bestDiff) {
                bestDiff = diff;
                best = size;
            }
        }
        return best;
    }

    /**
     * @return the prefix covering {@code value}, or null if none does
     */
    public IpPrefix find(BigInteger value) {
        int c = rightmostAtMost(bounds, value);
        if (c < 0) {
            return null;
        }
        Chunk chunk = chunks[c];
        // bounds[c] == chunk.starts[0] <= value, so i >= 0
        int i = rightmostAtMost(chunk.starts, value);
        return value.compareTo(chunk.ends[i]) <= 0 ? chunk.prefixes[i] : null;
    }

    private static int rightmostAtMost(BigInteger[] sorted, BigInteger value) {
        int pos = Arrays.binarySearch(sorted, value);
        return pos >= 0 ? pos : -pos - 2;
    }

    public IpFamily getFamily() { return family; }
    public List<IpPrefix> getPrefixes() { return prefixes; }
    public int size() { return prefixes.size(); }
    public boolean isEmpty() { return prefixes.isEmpty(); }
    public int getChunkSize() { return chunkSize; }
    public int getChunkCount() { return chunks.length; }
}
