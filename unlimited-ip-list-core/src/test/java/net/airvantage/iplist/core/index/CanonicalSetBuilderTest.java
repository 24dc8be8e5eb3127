/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core.index;

import net.airvantage.iplist.core.address.CidrParser;
import net.airvantage.iplist.core.address.IpFamily;
import net.airvantage.iplist.core.address.IpPrefix;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalSetBuilderTest {

    private static PrefixCandidate candidate(String text) {
        return PrefixCandidate.of(text, CidrParser.parse(text, false));
    }

    private static List<String> kept(CanonicalSetBuilder.Result result) {
        return result.kept().stream().map(IpPrefix::toString).collect(Collectors.toList());
    }

    private static List<String> redundantSources(CanonicalSetBuilder.Result result) {
        return result.redundant().stream().map(r -> r.candidate().source()).collect(Collectors.toList());
    }

    @Test
    void testEmpty() {
        CanonicalSetBuilder.Result result = CanonicalSetBuilder.build(IpFamily.IPV4, List.of());
        assertTrue(result.kept().isEmpty());
        assertTrue(result.redundant().isEmpty());
    }

    @Test
    void testSortsDisjointPrefixes() {
        CanonicalSetBuilder.Result result = CanonicalSetBuilder.build(IpFamily.IPV4, List.of(
            candidate("192.168.0.0/16"), candidate("10.0.0.0/8"), candidate("1.1.1.1/32")));
        assertEquals(List.of("1.1.1.1/32", "10.0.0.0/8", "192.168.0.0/16"), kept(result));
        assertTrue(result.redundant().isEmpty());
    }

    @Test
    void testDropsDuplicatesKeepingFirst() {
        PrefixCandidate first = candidate("10.0.0.0/8");
        PrefixCandidate second = PrefixCandidate.of("10.0.0.0/8 (again)", CidrParser.parse("10.0.0.0/8", false));
        CanonicalSetBuilder.Result result = CanonicalSetBuilder.build(IpFamily.IPV4, List.of(first, second));

        assertEquals(List.of("10.0.0.0/8"), kept(result));
        assertEquals(1, result.redundant().size());
        assertSame(second, result.redundant().get(0).candidate());
        assertEquals("10.0.0.0/8", result.redundant().get(0).coveredBy().toString());
    }

    @Test
    void testDropsContainedPrefixes() {
        CanonicalSetBuilder.Result result = CanonicalSetBuilder.build(IpFamily.IPV4, List.of(
            candidate("10.10.10.10/32"),
            candidate("10.0.0.0/8"),
            candidate("10.1.0.0/16"),
            candidate("11.0.0.0/8")));

        assertEquals(List.of("10.0.0.0/8", "11.0.0.0/8"), kept(result));
        assertEquals(List.of("10.1.0.0/16", "10.10.10.10/32"), redundantSources(result));
        result.redundant().forEach(r -> assertEquals("10.0.0.0/8", r.coveredBy().toString()));
    }

    @Test
    void testSameStartKeepsShortestLength() {
        CanonicalSetBuilder.Result result = CanonicalSetBuilder.build(IpFamily.IPV4, List.of(
            candidate("10.0.0.0/24"), candidate("10.0.0.0/16"), candidate("10.0.0.0/8")));
        assertEquals(List.of("10.0.0.0/8"), kept(result));
        assertEquals(List.of("10.0.0.0/16", "10.0.0.0/24"), redundantSources(result));
    }

    @Test
    void testAdjacentPrefixesAreKept() {
        CanonicalSetBuilder.Result result = CanonicalSetBuilder.build(IpFamily.IPV4, List.of(
            candidate("10.0.0.0/25"), candidate("10.0.0.128/25")));
        assertEquals(List.of("10.0.0.0/25", "10.0.0.128/25"), kept(result));
    }

    @Test
    void testExistingEntryDisplacedByBroaderCandidate() {
        PrefixCandidate existing = PrefixCandidate.existing(CidrParser.parse("10.1.0.0/16", false));
        CanonicalSetBuilder.Result result = CanonicalSetBuilder.build(IpFamily.IPV4, List.of(
            existing, candidate("10.0.0.0/8")));

        assertEquals(List.of("10.0.0.0/8"), kept(result));
        assertEquals(1, result.redundant().size());
        assertTrue(result.redundant().get(0).candidate().existing());
    }

    @Test
    void testExistingEntryWinsOverDuplicate() {
        PrefixCandidate existing = PrefixCandidate.existing(CidrParser.parse("10.0.0.0/8", false));
        CanonicalSetBuilder.Result result = CanonicalSetBuilder.build(IpFamily.IPV4, List.of(
            existing, candidate("10.0.0.0/8")));

        assertEquals(List.of("10.0.0.0/8"), kept(result));
        assertFalse(result.redundant().get(0).candidate().existing());
    }

    @Test
    void testIPv6() {
        CanonicalSetBuilder.Result result = CanonicalSetBuilder.build(IpFamily.IPV6, List.of(
            candidate("2001:db8::1/128"), candidate("2001:db8::/32"), candidate("::1/128")));
        assertEquals(List.of("::1/128", "2001:db8::/32"), kept(result));
        assertEquals(List.of("2001:db8::1/128"), redundantSources(result));
    }

    @Test
    void testRejectsForeignFamily() {
        assertThrows(IllegalArgumentException.class,
            () -> CanonicalSetBuilder.build(IpFamily.IPV6, List.of(candidate("10.0.0.0/8"))));
    }

    @Test
    void testRandomInputKeepsCoverageWithoutOverlap() {
        Random random = new Random(7);
        List<PrefixCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < 3000; i++) {
            int length = 9 + random.nextInt(24);
            // narrow /8 so that nesting is frequent
            BigInteger value = BigInteger.valueOf(0x0A000000L | (random.nextInt() & 0x00FFFFFFL));
            BigInteger start = value.andNot(IpFamily.IPV4.hostMask(length));
            IpPrefix prefix = IpPrefix.of(IpFamily.IPV4, start, length);
            candidates.add(PrefixCandidate.of(prefix.toString(), prefix));
        }

        CanonicalSetBuilder.Result result = CanonicalSetBuilder.build(IpFamily.IPV4, candidates);
        List<IpPrefix> kept = result.kept();

        assertEquals(candidates.size(), kept.size() + result.redundant().size());
        for (int i = 1; i < kept.size(); i++) {
            assertTrue(kept.get(i).getStart().compareTo(kept.get(i - 1).getEnd()) > 0,
                "Overlap between " + kept.get(i - 1) + " and " + kept.get(i));
        }
        for (CanonicalSetBuilder.Redundant r : result.redundant()) {
            assertTrue(r.coveredBy().covers(r.candidate().prefix()));
            assertTrue(kept.stream().anyMatch(k -> k.covers(r.candidate().prefix())),
                r.candidate().source() + " lost its coverage");
        }
    }
}
