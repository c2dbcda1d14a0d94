package com.questrail.cot.transport.udp;

import com.questrail.cot.observability.CotObservabilitySink;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.unix.DomainDatagramPacket;
import io.netty.channel.unix.DomainSocketAddress;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.UnixDomainSocketAddress;
import java.util.Objects;

/**
 * A datagram stream bound to a local address, sending to a destination given per call.
 */
public final class DatagramServer extends DatagramStream
{
    DatagramServer(CotObservabilitySink observabilitySink) {
        super(observabilitySink);
    }

    /**
     * Send {@code data} to {@code remote}, then block until the socket drains.
     *
     * @throws com.questrail.cot.transport.TransportClosedException if the stream is closed
     * @throws IOException if an earlier operation failed on the socket
     */
    public void send(byte[] data, SocketAddress remote) throws IOException, InterruptedException {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(remote, "remote");
        requireOpen();
        writeAndAwaitDrain(envelope(Unpooled.wrappedBuffer(data), remote));
    }

    private static Object envelope(ByteBuf content, SocketAddress remote) {
        if (remote instanceof InetSocketAddress inet) {
            return new DatagramPacket(content, inet);
        }
        if (remote instanceof UnixDomainSocketAddress unix) {
            return new DomainDatagramPacket(content, new DomainSocketAddress(unix.getPath().toString()));
        }
        throw new IllegalArgumentException("Unsupported destination address type: " + remote.getClass().getName());
    }
}
