/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core.index;

import net.airvantage.iplist.core.address.IpFamily;
import net.airvantage.iplist.core.address.IpPrefix;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Collapses the prefixes of one family into a sorted, non-overlapping set.
 *
 * <p>Exact duplicates are dropped first, keeping the first occurrence, so an
 * existing entry placed ahead of the new candidates always wins. The rest are
 * sorted by (start, length) and swept left to right: an entry starting at or
 * before the end of the last kept entry lies inside it, since two CIDR blocks
 * are either nested or disjoint, and is reported as redundant.
 */
public final class CanonicalSetBuilder {
    private CanonicalSetBuilder() {}

    private static final Comparator<PrefixCandidate> BY_PREFIX = Comparator.comparing(PrefixCandidate::prefix);

    /** A dropped candidate and the kept prefix that covers it. */
    public record Redundant(PrefixCandidate candidate, IpPrefix coveredBy) {}

    /** New canonical set, plus the redundant candidates in discovery order. */
    public record Result(List<IpPrefix> kept, List<Redundant> redundant) {
        public Result {
            kept = List.copyOf(kept);
            redundant = List.copyOf(redundant);
        }
    }

    /**
     * @param family     family every candidate must belong to
     * @param candidates existing entries first, then new candidates in encounter order
     */
    public static Result build(IpFamily family, List<PrefixCandidate> candidates) {
        List<Redundant> redundant = new ArrayList<>();

        Map<IpPrefix, PrefixCandidate> firstSeen = new HashMap<>();
        List<PrefixCandidate> unique = new ArrayList<>(candidates.size());
        for (PrefixCandidate candidate : candidates) {
            checkArgument(candidate.prefix().getFamily() == family,
                "Candidate %s does not belong to %s", candidate.source(), family);
            PrefixCandidate first = firstSeen.putIfAbsent(candidate.prefix(), candidate);
            if (first == null) {
                unique.add(candidate);
            } else {
                redundant.add(new Redundant(candidate, first.prefix()));
            }
        }

        // List.sort is stable; equal prefixes no longer exist at this point
        unique.sort(BY_PREFIX);

        List<IpPrefix> kept = new ArrayList<>(unique.size());
        IpPrefix last = null;
        for (PrefixCandidate candidate : unique) {
            IpPrefix prefix = candidate.prefix();
            if (last != null && prefix.getStart().compareTo(last.getEnd()) <= 0) {
                redundant.add(new Redundant(candidate, last));
            } else {
                kept.add(prefix);
                last = prefix;
            }
        }
        return new Result(kept, redundant);
    }
}
