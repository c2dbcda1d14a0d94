package com.questrail.cot.transport.udp;

import com.questrail.cot.observability.CotObservabilitySink;
import com.questrail.cot.transport.DatagramSink;

import io.netty.buffer.Unpooled;

import java.io.IOException;
import java.util.Objects;

/**
 * A datagram stream connected to a single remote peer.
 */
public final class DatagramClient extends DatagramStream implements DatagramSink
{
    DatagramClient(CotObservabilitySink observabilitySink) {
        super(observabilitySink);
    }

    /**
     * Send {@code data} to the connected peer, then block until the socket drains.
     *
     * @throws com.questrail.cot.transport.TransportClosedException if the stream is closed
     * @throws IOException if an earlier operation failed on the socket
     */
    @Override
    public void send(byte[] data) throws IOException, InterruptedException {
        Objects.requireNonNull(data, "data");
        writeAndAwaitDrain(Unpooled.wrappedBuffer(data));
    }
}
