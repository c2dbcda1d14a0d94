package com.questrail.cot.transport;

import java.net.SocketAddress;
import java.util.Objects;

/**
 * One received datagram and the address it came from.
 *
 * @param sender source address; {@code null} only for an unnamed local-domain peer
 */
public record Datagram(byte[] payload, SocketAddress sender)
{
    public Datagram {
        Objects.requireNonNull(payload, "payload");
    }
}
