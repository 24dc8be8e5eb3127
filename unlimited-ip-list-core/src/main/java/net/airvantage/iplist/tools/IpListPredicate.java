/**
 * BSD-3-Clause License.
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.tools;

import net.airvantage.iplist.core.UnlimitedIpList;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Predicate compatible class that tests whether an InetSocketAddress belongs to
 * one of the networks of an {@link UnlimitedIpList}, e.g. to filter trusted
 * proxies or load balancers.
 *
 * <p>Example usage:
 * <pre>
 * UnlimitedIpList trusted = new UnlimitedIpList(List.of("10.0.0.0/8", "2001:db8::/32"));
 * Predicate&lt;InetSocketAddress&gt; predicate = new IpListPredicate(trusted);
 * </pre>
 *
 * The predicate reads the list on every call, so later changes to the list are
 * seen immediately. An unresolved socket address never matches; no name
 * resolution is attempted.
 *
 * Thread-safety: thread-safe as long as the list is.
 */
public class IpListPredicate implements Predicate<InetSocketAddress> {
    private final UnlimitedIpList list;

    public IpListPredicate(UnlimitedIpList list) {
        this.list = Objects.requireNonNull(list, "list");
    }

    @Override
    public boolean test(InetSocketAddress socketAddress) {
        if (socketAddress == null) {
            return false;
        }

        InetAddress address = socketAddress.getAddress();
        if (address == null) {
            return false;
        }

        return list.check(address).isPresent();
    }

    public UnlimitedIpList getList() {
        return list;
    }

    @Override
    public String toString() {
        return "IpListPredicate" + list;
    }
}
