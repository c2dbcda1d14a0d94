package com.questrail.cot.transport;

import java.io.IOException;

/**
 * A source of whole datagrams.
 */
public non-sealed interface DatagramSource extends TransportReader
{
    /**
     * Block until a datagram arrives.
     *
     * @throws TransportClosedException if the transport is closed or closes while waiting
     * @throws IOException if an earlier operation on the transport failed
     */
    Datagram recv() throws IOException, InterruptedException;
}
