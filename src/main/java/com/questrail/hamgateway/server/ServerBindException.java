package com.questrail.hamgateway.server;

import java.net.SocketAddress;

/**
 * Thrown when a listener cannot bind its socket during construction.
 */
public final class ServerBindException extends RuntimeException
{
    private final SocketAddress address;

    public ServerBindException(String protocol, SocketAddress address, Throwable cause)
    {
        super("Failed to bind " + protocol + " listener on " + address, cause);
        this.address = address;
    }

    public SocketAddress address()
    {
        return address;
    }
}
