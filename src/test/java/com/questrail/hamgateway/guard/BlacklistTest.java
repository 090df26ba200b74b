package com.questrail.hamgateway.guard;

import org.junit.jupiter.api.Test;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BlacklistTest {

    @Test
    void defaultRangesReportTheirLabel() throws Exception {
        Blacklist blacklist = Blacklist.withDefaults();

        assertEquals(Optional.of(Blacklist.INTERNET_MEASUREMENT),
            blacklist.match(InetAddress.getByName("87.236.176.199")));
        assertEquals(Optional.of(Blacklist.INTERNET_MEASUREMENT),
            blacklist.match(InetAddress.getByName("68.183.53.77")));
        assertEquals(Optional.of(Blacklist.INTERNET_MEASUREMENT),
            blacklist.match(InetAddress.getByName("2a06:4880:1234::5")));
        assertEquals(Optional.of(Blacklist.INTERNET_MEASUREMENT),
            blacklist.match(InetAddress.getByName("2604:a880:800:10::c4b:f00f")));
    }

    @Test
    void addressesOutsideAllRangesAreNotBlacklisted() throws Exception {
        Blacklist blacklist = Blacklist.withDefaults();

        assertFalse(blacklist.isBlacklisted(InetAddress.getByName("87.236.177.1")));
        assertFalse(blacklist.isBlacklisted(InetAddress.getByName("68.183.53.78")));
        assertFalse(blacklist.isBlacklisted(InetAddress.getByName("127.0.0.1")));
        assertFalse(blacklist.isBlacklisted(InetAddress.getByName("::1")));
        assertFalse(blacklist.isBlacklisted(InetAddress.getByName("2604:a880:800:10::c4b:e000")));
    }

    @Test
    void ipv4MappedFormOfBlacklistedAddressIsBlacklisted() throws Exception {
        Blacklist blacklist = Blacklist.withDefaults();

        InetAddress mapped = ipv4Mapped(193, 163, 125, 17);
        assertTrue(mapped instanceof Inet6Address, "JDK must keep the mapped form for this test");

        assertEquals(Optional.of(Blacklist.INTERNET_MEASUREMENT), blacklist.match(mapped));
        assertFalse(blacklist.isBlacklisted(ipv4Mapped(193, 163, 126, 17)));
    }

    @Test
    void addedRangesAreMatchedUnderTheirOwnLabel() throws Exception {
        Blacklist blacklist = Blacklist.empty()
            .add("documentation", List.of("192.0.2.0/24", "2001:db8::/32"))
            .add("single-host", List.of("198.51.100.7"));

        assertEquals(Optional.of("documentation"), blacklist.match(InetAddress.getByName("192.0.2.200")));
        assertEquals(Optional.of("documentation"), blacklist.match(InetAddress.getByName("2001:db8:ffff::1")));
        assertEquals(Optional.of("single-host"), blacklist.match(InetAddress.getByName("198.51.100.7")));
        assertEquals(Optional.empty(), blacklist.match(InetAddress.getByName("198.51.100.8")));
        assertEquals(List.of("documentation", "single-host"), List.copyOf(blacklist.labels()));
    }

    @Test
    void emptyBlacklistMatchesNothing() throws Exception {
        assertFalse(Blacklist.empty().isBlacklisted(InetAddress.getByName("87.236.176.199")));
    }

    @Test
    void rejectsDuplicateLabelsAndMalformedRanges() {
        Blacklist blacklist = Blacklist.withDefaults();

        assertThrows(IllegalArgumentException.class,
            () -> blacklist.add(Blacklist.INTERNET_MEASUREMENT, List.of("192.0.2.0/24")));
        assertThrows(IllegalArgumentException.class,
            () -> blacklist.add("bad-address", List.of("example.com/24")));
        assertThrows(IllegalArgumentException.class,
            () -> blacklist.add("bad-prefix", List.of("192.0.2.0/33")));
        assertThrows(IllegalArgumentException.class,
            () -> blacklist.add("bad-prefix-text", List.of("192.0.2.0/x")));

        assertEquals(1, blacklist.labels().size(), "failed adds must leave the blacklist unchanged");
    }

    @Test
    void normalizationLeavesOtherAddressesUnchanged() throws Exception {
        InetAddress v4 = InetAddress.getByName("192.0.2.1");
        InetAddress v6 = InetAddress.getByName("2001:db8::1");

        assertSame(v4, SourceAddresses.normalize(v4));
        assertSame(v6, SourceAddresses.normalize(v6));

        InetAddress normalized = SourceAddresses.normalize(ipv4Mapped(192, 0, 2, 1));
        assertTrue(normalized instanceof Inet4Address);
        assertEquals(v4, normalized);
    }

    /**
     * Builds {@code ::ffff:a.b.c.d} as an {@link Inet6Address}; the JDK's
     * parser would collapse the literal to IPv4.
     */
    static InetAddress ipv4Mapped(int a, int b, int c, int d) throws UnknownHostException {
        byte[] bytes = new byte[16];
        bytes[10] = (byte) 0xFF;
        bytes[11] = (byte) 0xFF;
        bytes[12] = (byte) a;
        bytes[13] = (byte) b;
        bytes[14] = (byte) c;
        bytes[15] = (byte) d;
        return Inet6Address.getByAddress(null, bytes, -1);
    }
}
