/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core;

import io.netty.handler.ipfilter.IpFilterRuleType;
import io.netty.handler.ipfilter.IpSubnetFilterRule;
import net.airvantage.iplist.core.address.CidrParser;
import net.airvantage.iplist.core.address.IpFamily;
import net.airvantage.iplist.core.address.IpPrefix;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks lookups on large random lists against Netty's subnet filter rules.
 */
class UnlimitedIpListScaleTest {

    private Random random;
    private List<String> addresses;
    private List<String> networks;

    @BeforeEach
    void setUp() {
        random = new Random(42);
        addresses = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            addresses.add(i % 2 == 0 ? randomIPv4() : randomIPv6());
        }
        Collections.shuffle(addresses, random);

        networks = new ArrayList<>();
        for (String address : addresses.subList(500, 1000)) {
            networks.add(address + (address.indexOf(':') >= 0 ? "/64" : "/24"));
        }
        // broader networks make some of the above redundant
        for (int i = 0; i < 20; i++) {
            String address = addresses.get(random.nextInt(1000));
            networks.add(address + (address.indexOf(':') >= 0 ? "/40" : "/12"));
        }
    }

    @Test
    void testLookupsMatchNettyRules() throws UnknownHostException {
        UnlimitedIpList list = new UnlimitedIpList(networks, IpListOptions.builder().normalizeInvalidCidr(true).build());
        List<IpSubnetFilterRule> rules = new ArrayList<>();
        for (String network : networks) {
            int slash = network.indexOf('/');
            rules.add(new IpSubnetFilterRule(InetAddress.getByName(network.substring(0, slash)),
                Integer.parseInt(network.substring(slash + 1)), IpFilterRuleType.ACCEPT));
        }

        List<String> queries = new ArrayList<>(addresses);
        for (int i = 0; i < 2000; i++) {
            queries.add(i % 2 == 0 ? randomIPv4() : randomIPv6());
        }

        int ipv4Found = 0;
        int ipv6Found = 0;
        for (String query : queries) {
            InetSocketAddress socketAddress = new InetSocketAddress(InetAddress.getByName(query), 0);
            boolean expected = rules.stream().anyMatch(rule -> rule.matches(socketAddress));
            Optional<String> found = list.check(query);

            assertEquals(expected, found.isPresent(), "Lookup of " + query);
            if (found.isPresent()) {
                IpPrefix prefix = CidrParser.parse(found.get(), false);
                IpSubnetFilterRule rule = new IpSubnetFilterRule(prefix.getNetworkAddress().toString(),
                    prefix.getLength(), IpFilterRuleType.ACCEPT);
                assertTrue(rule.matches(socketAddress), found.get() + " does not contain " + query);
                if (prefix.getFamily() == IpFamily.IPV4) {
                    ipv4Found++;
                } else {
                    ipv6Found++;
                }
            }
        }
        assertTrue(ipv4Found > 0);
        assertTrue(ipv6Found > 0);
    }

    @Test
    void testOverlappingNetworksAreCollapsed() {
        List<String> input = new ArrayList<>();
        for (int i = 0; i < 10_000; i++) {
            // 4096 possible /24 networks in 10.0.0.0/12
            input.add("10." + random.nextInt(16) + "." + random.nextInt(256) + ".0/24");
        }
        Set<String> distinct = new HashSet<>(input);

        UnlimitedIpList list = new UnlimitedIpList(input);
        int n = list.size();

        assertTrue(n < input.size());
        assertEquals(distinct.size(), n);
        assertEquals(input.size() - n, list.getLastDiscarded().size());
        assertTrue(list.getLastDiscarded().stream().allMatch(DiscardedEntry::isRedundant));

        // both bisection levels stay close to sqrt(n)
        int bound = (int) Math.ceil(Math.sqrt(n)) + 2;
        assertTrue(list.getChunkSize(IpFamily.IPV4) <= bound, "chunk size " + list.getChunkSize(IpFamily.IPV4));
        assertTrue(list.getChunkCount(IpFamily.IPV4) <= bound, "chunk count " + list.getChunkCount(IpFamily.IPV4));

        for (String network : distinct) {
            String probe = network.substring(0, network.length() - "0/24".length()) + "99";
            assertEquals(Optional.of(network), list.check(probe));
        }
    }

    private String randomIPv4() {
        long value = 184549376L + (long) (random.nextDouble() * (3758096383L - 184549376L));
        return (value >>> 24) + "." + ((value >>> 16) & 0xFF) + "." + ((value >>> 8) & 0xFF) + "." + (value & 0xFF);
    }

    private String randomIPv6() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 8; i++) {
            if (i > 0) sb.append(':');
            // non-zero first group keeps the value away from the IPv4-mapped range
            sb.append(Integer.toHexString(i == 0 ? 0x2000 + random.nextInt(0x1000) : random.nextInt(0x10000)));
        }
        return sb.toString();
    }
}
