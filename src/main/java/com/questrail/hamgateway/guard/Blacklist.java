package com.questrail.hamgateway.guard;

import io.netty.handler.ipfilter.IpFilterRuleType;
import io.netty.handler.ipfilter.IpSubnetFilterRule;
import io.netty.util.NetUtil;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Blacklist
 * =============================================================================
 * Labeled sets of CIDR ranges whose sources are refused by every listener.
 *
 * <h2>Matching</h2>
 * {@link #match(InetAddress)} answers the label of the first range set that
 * contains the address. IPv4-mapped IPv6 addresses are normalized to IPv4
 * first, so {@code ::ffff:87.236.176.5} matches {@code 87.236.176.0/24}.
 *
 * <h2>Concurrency</h2>
 * Reads are lock-free against an immutable snapshot; {@link #add(String, Collection)}
 * publishes a new snapshot. Adding ranges while listeners are running is
 * safe; an in-flight lookup sees either the old or the new set.
 */
public final class Blacklist
{
    public static final String INTERNET_MEASUREMENT = "internet-measurement.com";

    private static final List<String> INTERNET_MEASUREMENT_RANGES = List.of(
        "87.236.176.0/24",
        "193.163.125.0/24",
        "68.183.53.77/32",
        "104.248.203.191/32",
        "104.248.204.195/32",
        "142.93.191.98/32",
        "157.245.216.203/32",
        "165.22.39.64/32",
        "167.99.209.184/32",
        "188.166.26.88/32",
        "206.189.7.178/32",
        "209.97.152.248/32",
        "2a06:4880::/32",
        "2604:a880:800:10::c4b:f000/124",
        "2604:a880:800:10::c51:a000/124",
        "2604:a880:800:10::c52:d000/124",
        "2604:a880:800:10::c55:5000/124",
        "2604:a880:800:10::c56:b000/124",
        "2a03:b0c0:2:d0::153e:a000/124",
        "2a03:b0c0:2:d0::1576:8000/124",
        "2a03:b0c0:2:d0::1577:7000/124",
        "2a03:b0c0:2:d0::1579:e000/124",
        "2a03:b0c0:2:d0::157c:a000/124"
    );

    private final Object writeLock = new Object();
    private volatile Map<String, List<IpSubnetFilterRule>> ranges = Collections.emptyMap();

    private Blacklist() {}

    /**
     * Creates a blacklist with no ranges.
     */
    public static Blacklist empty()
    {
        return new Blacklist();
    }

    /**
     * Creates a blacklist seeded with the known scanner ranges of
     * {@value #INTERNET_MEASUREMENT}.
     */
    public static Blacklist withDefaults()
    {
        return new Blacklist().add(INTERNET_MEASUREMENT, INTERNET_MEASUREMENT_RANGES);
    }

    /**
     * Adds a labeled set of CIDR ranges. A range without a prefix length is
     * treated as a single host.
     *
     * @throws IllegalArgumentException if the label is already present or a
     *                                  range is not a valid IP literal with an
     *                                  in-bounds prefix length
     */
    public Blacklist add(String label, Collection<String> cidrs)
    {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(cidrs, "cidrs");
        if (label.isBlank()) {
            throw new IllegalArgumentException("label must not be blank");
        }

        List<IpSubnetFilterRule> rules = new ArrayList<>(cidrs.size());
        for (String cidr : cidrs) {
            rules.add(parseRange(cidr));
        }

        synchronized (writeLock) {
            if (ranges.containsKey(label)) {
                throw new IllegalArgumentException("Blacklist label already present: " + label);
            }
            Map<String, List<IpSubnetFilterRule>> next = new LinkedHashMap<>(ranges);
            next.put(label, List.copyOf(rules));
            ranges = Collections.unmodifiableMap(next);
        }
        return this;
    }

    /**
     * Returns the label of the first range set containing {@code address}.
     */
    public Optional<String> match(InetAddress address)
    {
        InetSocketAddress candidate = new InetSocketAddress(SourceAddresses.normalize(address), 0);

        for (Map.Entry<String, List<IpSubnetFilterRule>> entry : ranges.entrySet()) {
            for (IpSubnetFilterRule rule : entry.getValue()) {
                if (rule.matches(candidate)) {
                    return Optional.of(entry.getKey());
                }
            }
        }
        return Optional.empty();
    }

    public boolean isBlacklisted(InetAddress address)
    {
        return match(address).isPresent();
    }

    public Set<String> labels()
    {
        return ranges.keySet();
    }

    static IpSubnetFilterRule parseRange(String cidr)
    {
        Objects.requireNonNull(cidr, "cidr");

        String literal = cidr.trim();
        String prefixPart = null;
        int slash = literal.indexOf('/');
        if (slash >= 0) {
            prefixPart = literal.substring(slash + 1);
            literal = literal.substring(0, slash);
        }

        InetAddress network = NetUtil.createInetAddressFromIpAddressString(literal);
        if (network == null) {
            throw new IllegalArgumentException("Invalid blacklist range: '" + cidr + "'");
        }

        int maxPrefix = network instanceof Inet4Address ? 32 : 128;
        int prefix = maxPrefix;
        if (prefixPart != null) {
            try {
                prefix = Integer.parseInt(prefixPart);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid prefix length in blacklist range: '" + cidr + "'", e);
            }
            if (prefix < 0 || prefix > maxPrefix) {
                throw new IllegalArgumentException("Prefix length out of range in blacklist range: '" + cidr + "'");
            }
        }

        return new IpSubnetFilterRule(network, prefix, IpFilterRuleType.REJECT);
    }
}
