package com.questrail.hamgateway.guard;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Objects;

/**
 * Normalization of source addresses used as blacklist and rate-limit keys.
 */
public final class SourceAddresses
{
    private SourceAddresses() {}

    /**
     * Maps an IPv4-mapped IPv6 address ({@code ::ffff:a.b.c.d}) to its IPv4
     * form. Every other address is returned unchanged.
     */
    public static InetAddress normalize(InetAddress address)
    {
        Objects.requireNonNull(address, "address");

        if (!(address instanceof Inet6Address)) {
            return address;
        }

        byte[] bytes = address.getAddress();
        for (int i = 0; i < 10; i++) {
            if (bytes[i] != 0) {
                return address;
            }
        }
        if (bytes[10] != (byte) 0xFF || bytes[11] != (byte) 0xFF) {
            return address;
        }

        byte[] v4 = new byte[] { bytes[12], bytes[13], bytes[14], bytes[15] };
        try {
            return Inet4Address.getByAddress(v4);
        } catch (UnknownHostException e) {
            // Only thrown for illegal lengths; four bytes is always legal.
            throw new IllegalStateException(e);
        }
    }
}
