/**
 * BSD-3-Clause License.
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core;

import net.airvantage.iplist.core.address.CidrParser;
import net.airvantage.iplist.core.address.IpAddress;
import net.airvantage.iplist.core.address.IpAddresses;
import net.airvantage.iplist.core.address.IpFamily;
import net.airvantage.iplist.core.address.IpPrefix;
import net.airvantage.iplist.core.cache.NoOpLookupCache;
import net.airvantage.iplist.core.index.CanonicalSetBuilder;
import net.airvantage.iplist.core.index.ChunkIndex;
import net.airvantage.iplist.core.index.PrefixCandidate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * A list of IPv4/IPv6 networks answering "which stored network covers this
 * address" in {@code O(log n)}, whatever the list size.
 *
 * <p>Networks are kept per family as a sorted set without overlaps: on every
 * mutation duplicates and networks contained in a broader one are dropped
 * (and reported), then a chunked binary search index is rebuilt.
 *
 * <p>Example usage:
 * <pre>
 * UnlimitedIpList list = new UnlimitedIpList(List.of("10.0.0.0/8", "2001:db8::/32"));
 * list.check("10.0.0.42");     // Optional[10.0.0.0/8]
 * list.check("192.168.2.1");   // Optional.empty
 * </pre>
 *
 * Thread-safety: lookups never block. Mutations are serialized; each one builds
 * a new immutable index off to the side and publishes it with a single
 * volatile write, so a lookup always sees either the old or the new index.
 */
public final class UnlimitedIpList implements Iterable<String> {
    private static final Logger LOG = LoggerFactory.getLogger(UnlimitedIpList.class);

    // unique across lists, so a cache shared between lists never serves another list's result
    private static final AtomicLong GENERATIONS = new AtomicLong();

    private final IpListOptions options;
    private final ReentrantLock writeLock = new ReentrantLock();

    private volatile IndexSnapshot snapshot = IndexSnapshot.empty(GENERATIONS.incrementAndGet());
    private volatile List<DiscardedEntry> lastDiscarded = List.of();
    private volatile LookupCache cache = NoOpLookupCache.INSTANCE;
    private volatile IpListMetricsListener metrics;

    private record ParsedBatch(List<PrefixCandidate> candidates, List<DiscardedEntry> invalid) {}

    public UnlimitedIpList() {
        this(List.of(), IpListOptions.DEFAULTS);
    }

    public UnlimitedIpList(Collection<String> networks) {
        this(networks, IpListOptions.DEFAULTS);
    }

    /**
     * @throws IpListException in {@link ErrorMode#RAISE} mode, for the first malformed network
     */
    public UnlimitedIpList(Collection<String> networks, IpListOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        Objects.requireNonNull(networks, "networks");
        if (!networks.isEmpty()) {
            addAll(networks);
        }
    }

    public UnlimitedIpList setCache(LookupCache cache) {
        this.cache = cache != null ? cache : NoOpLookupCache.INSTANCE;
        return this;
    }

    public UnlimitedIpList setMetrics(IpListMetricsListener metrics) {
        this.metrics = metrics;
        return this;
    }

    public IpListOptions getOptions() {
        return options;
    }

    // ========== Lookups ==========

    /**
     * Returns the stored network covering the address, e.g. {@code "10.0.0.0/8"}
     * for {@code "10.0.0.42"}.
     *
     * @throws InvalidAddressException in {@link ErrorMode#RAISE} mode, if the text is not an IP address
     */
    public Optional<String> check(String address) {
        IpAddress parsed;
        try {
            parsed = IpAddresses.parse(address);
        } catch (InvalidAddressException e) {
            return invalidLookup(address, e);
        }
        return check(parsed);
    }

    /**
     * Integer form: values up to 2^32 - 1 are taken as IPv4, larger ones as IPv6.
     */
    public Optional<String> check(BigInteger address) {
        IpAddress parsed;
        try {
            parsed = IpAddresses.fromInteger(address);
        } catch (InvalidAddressException e) {
            return invalidLookup(String.valueOf(address), e);
        }
        return check(parsed);
    }

    public Optional<String> check(BigInteger address, IpFamily family) {
        IpAddress parsed;
        try {
            parsed = IpAddresses.fromInteger(address, family);
        } catch (InvalidAddressException e) {
            return invalidLookup(String.valueOf(address), e);
        }
        return check(parsed);
    }

    public Optional<String> check(long address) {
        return check(BigInteger.valueOf(address));
    }

    public Optional<String> check(InetAddress address) {
        if (address == null) {
            return invalidLookup(null, new InvalidAddressException("Address cannot be null", null));
        }
        return check(IpAddresses.fromInetAddress(address));
    }

    public Optional<String> check(IpAddress address) {
        Objects.requireNonNull(address, "address");
        IndexSnapshot current = snapshot;
        LookupCache lookupCache = cache;
        IpListMetricsListener m = metrics;

        CachedLookup cached = lookupCache.get(address);
        if (cached != null && cached.getGeneration() == current.generation()) {
            if (m != null) m.onCacheHit(address);
            return cached.getNetwork();
        }
        if (m != null && lookupCache != NoOpLookupCache.INSTANCE) m.onCacheMiss(address);

        IpPrefix match = current.index(address.getFamily()).find(address.getValue());
        String network = match != null ? match.toString() : null;
        lookupCache.put(address, new CachedLookup(current.generation(), network));

        LOG.trace("Lookup {} -> {}", address, network);
        if (m != null) {
            if (network != null) {
                m.onMatch(address, network);
            } else {
                m.onMiss(address);
            }
        }
        return Optional.ofNullable(network);
    }

    public boolean matches(String address) {
        return check(address).isPresent();
    }

    public boolean matches(InetAddress address) {
        return check(address).isPresent();
    }

    private Optional<String> invalidLookup(String input, InvalidAddressException e) {
        LOG.trace("Invalid address in lookup: {}", input);
        IpListMetricsListener m = metrics;
        if (m != null) m.onInvalidInput(input, e);
        if (options.isRaiseOnError()) {
            throw e;
        }
        return Optional.empty();
    }

    // ========== Mutations ==========

    /**
     * Adds one network ({@code "10.0.0.0/8"}, {@code "1.2.3.4"}, {@code "2001:db8::/32"}).
     *
     * @throws IpListException in {@link ErrorMode#RAISE} mode, if the network is malformed
     */
    public MutationResult add(String network) {
        return mutateAdd(Collections.singletonList(network), false, false);
    }

    /**
     * Adds a batch of networks. Null and blank entries are skipped. In
     * {@link ErrorMode#DISCARD} mode malformed entries are discarded and the rest
     * applied; in {@link ErrorMode#RAISE} mode the first malformed entry aborts
     * the whole batch.
     */
    public MutationResult addAll(Collection<String> networks) {
        return mutateAdd(networks, true, false);
    }

    /**
     * Clears the list and adds the networks, published as a single change.
     */
    public MutationResult replaceAll(Collection<String> networks) {
        return mutateAdd(networks, true, true);
    }

    /**
     * Removes one stored network. The input goes through the same parsing and
     * normalization as {@link #add(String)} and must then match a stored network
     * exactly; a network merely contained in a stored one is not found.
     *
     * @throws PrefixNotFoundException in {@link ErrorMode#RAISE} mode, if the network is not stored
     */
    public MutationResult remove(String network) {
        return mutateRemove(Collections.singletonList(network), false);
    }

    public MutationResult removeAll(Collection<String> networks) {
        return mutateRemove(networks, true);
    }

    public MutationResult clear() {
        writeLock.lock();
        try {
            lastDiscarded = List.of();
            IndexSnapshot base = snapshot;
            if (base.size() == 0) {
                return MutationResult.EMPTY;
            }
            IndexSnapshot next = IndexSnapshot.empty(GENERATIONS.incrementAndGet());
            publish(next);
            diag("Cleared the list ({} networks)", base.size());
            return new MutationResult(List.of(), texts(base.prefixes()), List.of());
        } finally {
            writeLock.unlock();
        }
    }

    private MutationResult mutateAdd(Collection<String> networks, boolean batch, boolean replace) {
        Objects.requireNonNull(networks, "networks");
        writeLock.lock();
        try {
            lastDiscarded = List.of();
            IndexSnapshot base = snapshot;
            ParsedBatch parsed = parse(networks, batch);

            Map<IpFamily, List<PrefixCandidate>> byFamily = new EnumMap<>(IpFamily.class);
            for (IpFamily family : IpFamily.values()) {
                List<PrefixCandidate> working = new ArrayList<>();
                if (!replace) {
                    for (IpPrefix existing : base.index(family).getPrefixes()) {
                        working.add(PrefixCandidate.existing(existing));
                    }
                }
                byFamily.put(family, working);
            }
            boolean[] touched = new boolean[IpFamily.values().length];
            for (PrefixCandidate candidate : parsed.candidates()) {
                IpFamily family = candidate.prefix().getFamily();
                byFamily.get(family).add(candidate);
                touched[family.ordinal()] = true;
            }

            List<DiscardedEntry> discarded = new ArrayList<>(parsed.invalid());
            Map<IpFamily, ChunkIndex> indexes = new EnumMap<>(IpFamily.class);
            for (IpFamily family : IpFamily.values()) {
                if (!touched[family.ordinal()] && !replace) {
                    indexes.put(family, base.index(family));
                    continue;
                }
                List<PrefixCandidate> working = byFamily.get(family);
                diag("Building {} set from {} entries", family, working.size());
                CanonicalSetBuilder.Result built = CanonicalSetBuilder.build(family, working);
                for (CanonicalSetBuilder.Redundant r : built.redundant()) {
                    if (r.candidate().existing()) {
                        diag("Stored network {} replaced by broader {}", r.candidate().source(), r.coveredBy());
                    } else {
                        discarded.add(new DiscardedEntry(r.candidate().source(), DiscardedEntry.Cause.REDUNDANT,
                            "covered by " + r.coveredBy()));
                    }
                }
                indexes.put(family, rebuild(family, built.kept()));
            }

            return commit(base, indexes, discarded);
        } finally {
            writeLock.unlock();
        }
    }

    private MutationResult mutateRemove(Collection<String> networks, boolean batch) {
        Objects.requireNonNull(networks, "networks");
        writeLock.lock();
        try {
            lastDiscarded = List.of();
            IndexSnapshot base = snapshot;
            ParsedBatch parsed = parse(networks, batch);

            Set<IpPrefix> stored = new HashSet<>(base.prefixes());
            Set<IpPrefix> toRemove = new HashSet<>();
            for (PrefixCandidate candidate : parsed.candidates()) {
                if (stored.contains(candidate.prefix())) {
                    toRemove.add(candidate.prefix());
                } else if (options.isRaiseOnError()) {
                    throw new PrefixNotFoundException("Network " + candidate.prefix() + " not found in the list", candidate.source());
                } else {
                    diag("Network {} not found in the list", candidate.prefix());
                }
            }

            // removing entries cannot create overlaps, only the chunks are rebuilt
            Map<IpFamily, ChunkIndex> indexes = new EnumMap<>(IpFamily.class);
            for (IpFamily family : IpFamily.values()) {
                ChunkIndex current = base.index(family);
                boolean affected = toRemove.stream().anyMatch(p -> p.getFamily() == family);
                if (!affected) {
                    indexes.put(family, current);
                    continue;
                }
                List<IpPrefix> remaining = current.getPrefixes().stream()
                    .filter(p -> !toRemove.contains(p))
                    .collect(Collectors.toList());
                indexes.put(family, rebuild(family, remaining));
            }

            return commit(base, indexes, parsed.invalid());
        } finally {
            writeLock.unlock();
        }
    }

    private ParsedBatch parse(Collection<String> networks, boolean skipBlank) {
        boolean normalize = options.isNormalizeInvalidCidr();
        List<PrefixCandidate> candidates = new ArrayList<>(networks.size());
        List<DiscardedEntry> invalid = new ArrayList<>();
        for (String network : networks) {
            if (skipBlank && (network == null || network.isBlank())) {
                continue;
            }
            String source = network != null ? network.strip() : null;
            try {
                IpPrefix prefix = CidrParser.parse(network, normalize);
                if (normalize && !prefix.toString().equals(source)) {
                    diag("Normalized network {} => {}", source, prefix);
                }
                candidates.add(PrefixCandidate.of(source, prefix));
            } catch (IpListException e) {
                IpListMetricsListener m = metrics;
                if (m != null) m.onInvalidInput(source, e);
                if (options.isRaiseOnError()) {
                    throw e;
                }
                diag("Invalid network {}: {}", source, e.getMessage());
                invalid.add(new DiscardedEntry(source, DiscardedEntry.Cause.INVALID, e.getMessage()));
            }
        }
        return new ParsedBatch(candidates, invalid);
    }

    private ChunkIndex rebuild(IpFamily family, List<IpPrefix> canonical) {
        ChunkIndex index = ChunkIndex.build(family, canonical, options.getMinChunkSize(), options.getMaxChunkSize());
        diag("Indexed {} {} networks in {} chunks of {}", index.size(), family, index.getChunkCount(), index.getChunkSize());
        return index;
    }

    private MutationResult commit(IndexSnapshot base, Map<IpFamily, ChunkIndex> indexes, List<DiscardedEntry> discarded) {
        List<String> added = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        List<IpFamily> rebuilt = new ArrayList<>();
        for (IpFamily family : IpFamily.values()) {
            ChunkIndex before = base.index(family);
            ChunkIndex after = indexes.get(family);
            if (before == after) {
                continue;
            }
            rebuilt.add(family);
            Set<IpPrefix> old = new HashSet<>(before.getPrefixes());
            Set<IpPrefix> now = new HashSet<>(after.getPrefixes());
            after.getPrefixes().stream().filter(p -> !old.contains(p)).forEach(p -> added.add(p.toString()));
            before.getPrefixes().stream().filter(p -> !now.contains(p)).forEach(p -> removed.add(p.toString()));
        }

        if (!added.isEmpty() || !removed.isEmpty()) {
            publish(new IndexSnapshot(GENERATIONS.incrementAndGet(), indexes.get(IpFamily.IPV4), indexes.get(IpFamily.IPV6)));
            IpListMetricsListener m = metrics;
            if (m != null) {
                for (IpFamily family : rebuilt) {
                    ChunkIndex index = indexes.get(family);
                    m.onRebuild(family, index.size(), index.getChunkCount());
                }
            }
        }

        lastDiscarded = List.copyOf(discarded);
        if (!discarded.isEmpty()) {
            diag("Discarded {} invalid or redundant networks", discarded.size());
            LOG.trace("Discarded: {}", discarded);
            IpListMetricsListener m = metrics;
            if (m != null) discarded.forEach(m::onDiscarded);
        }
        return new MutationResult(added, removed, discarded);
    }

    private void publish(IndexSnapshot next) {
        snapshot = next;
        cache.clear();
    }

    // ========== Queries on the stored networks ==========

    /**
     * Tells, without changing the list, whether the network would be accepted
     * by {@link #add(String)}: returns its canonical text, or empty if it is
     * malformed or already covered by a stored network.
     *
     * @throws IpListException in {@link ErrorMode#RAISE} mode, if the network is malformed
     */
    public Optional<String> testNetwork(String network) {
        IpPrefix prefix;
        try {
            prefix = CidrParser.parse(network, options.isNormalizeInvalidCidr());
        } catch (IpListException e) {
            if (options.isRaiseOnError()) {
                throw e;
            }
            return Optional.empty();
        }
        IpPrefix covering = snapshot.index(prefix.getFamily()).find(prefix.getStart());
        if (covering != null && covering.covers(prefix)) {
            diag("Network {} is covered by stored network {}", prefix, covering);
            return Optional.empty();
        }
        return Optional.of(prefix.toString());
    }

    /**
     * Whether this exact network is stored (after the usual parsing and normalization).
     */
    public boolean containsNetwork(String network) {
        IpPrefix prefix;
        try {
            prefix = CidrParser.parse(network, options.isNormalizeInvalidCidr());
        } catch (IpListException e) {
            return false;
        }
        return prefix.equals(snapshot.index(prefix.getFamily()).find(prefix.getStart()));
    }

    /** Stored networks, IPv4 first then IPv6, each sorted. */
    public List<String> getNetworks() {
        return texts(snapshot.prefixes());
    }

    public List<String> getNetworks(IpFamily family) {
        return texts(snapshot.index(family).getPrefixes());
    }

    public String get(int index) {
        return snapshot.get(index).toString();
    }

    public int size() {
        return snapshot.size();
    }

    public int size(IpFamily family) {
        return snapshot.index(family).size();
    }

    public boolean isEmpty() {
        return snapshot.size() == 0;
    }

    public int getChunkCount(IpFamily family) {
        return snapshot.index(family).getChunkCount();
    }

    public int getChunkSize(IpFamily family) {
        return snapshot.index(family).getChunkSize();
    }

    /** Inputs rejected by the most recent mutating call. */
    public List<DiscardedEntry> getLastDiscarded() {
        return lastDiscarded;
    }

    public List<String> getLastDiscardedInputs() {
        return lastDiscarded.stream().map(DiscardedEntry::getInput).collect(Collectors.toList());
    }

    @Override
    public Iterator<String> iterator() {
        return getNetworks().iterator();
    }

    @Override
    public String toString() {
        return getNetworks().toString();
    }

    private static List<String> texts(List<IpPrefix> prefixes) {
        List<String> texts = new ArrayList<>(prefixes.size());
        for (IpPrefix prefix : prefixes) {
            texts.add(prefix.toString());
        }
        return Collections.unmodifiableList(texts);
    }

    private void diag(String format, Object... args) {
        if (options.isVerboseDiagnostics()) {
            LOG.info(format, args);
        } else {
            LOG.debug(format, args);
        }
    }
}
