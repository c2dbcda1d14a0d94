package com.questrail.cot.transport;

import java.io.IOException;

/**
 * A sink bound to one remote peer; each call sends one datagram.
 */
public non-sealed interface DatagramSink extends TransportWriter
{
    /**
     * Send {@code data} and block until the transport can accept more.
     *
     * @throws TransportClosedException if the transport is closed
     * @throws IOException if an earlier operation on the transport failed
     */
    void send(byte[] data) throws IOException, InterruptedException;
}
