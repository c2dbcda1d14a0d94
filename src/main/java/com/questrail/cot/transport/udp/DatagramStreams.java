package com.questrail.cot.transport.udp;

import com.questrail.cot.observability.CotObservabilitySink;
import com.questrail.cot.transport.NettyFutures;
import com.questrail.cot.transport.TransportContext;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.epoll.EpollDomainDatagramChannel;
import io.netty.channel.socket.nio.NioDatagramChannel;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.DatagramChannel;
import java.nio.channels.NetworkChannel;
import java.util.Objects;

/**
 * DatagramStreams
 * -----------------------------------------------------------------------------
 * Factory for {@link DatagramStream}s.
 *
 * <p>The address shape picks the socket family: an {@link InetSocketAddress}
 * gives an INET/INET6 socket (resolution left to the JDK); a
 * {@link UnixDomainSocketAddress} gives a local-domain datagram socket, which
 * needs Netty's native epoll transport.</p>
 *
 * <p>All methods block until the socket is registered with the event loop and
 * must not be called from an event loop thread.</p>
 */
public final class DatagramStreams
{
    private DatagramStreams() {}

    /**
     * Bind a server stream to {@code local}.
     */
    public static DatagramServer bind(TransportContext context, SocketAddress local)
            throws IOException, InterruptedException
    {
        Objects.requireNonNull(local, "local");
        DatagramServer server = new DatagramServer(context.observabilitySink());
        Channel ch = NettyFutures.await(bootstrap(context, local, server).bind(DatagramStream.toNettyAddress(local)));
        server.attach(ch);
        return server;
    }

    /**
     * Connect a client stream to {@code remote}, bound to an ephemeral local address.
     */
    public static DatagramClient connect(TransportContext context, SocketAddress remote)
            throws IOException, InterruptedException
    {
        return connect(context, remote, null);
    }

    /**
     * Connect a client stream to {@code remote}.
     *
     * @param local local address to bind first; {@code null} for an ephemeral one
     */
    public static DatagramClient connect(TransportContext context, SocketAddress remote, SocketAddress local)
            throws IOException, InterruptedException
    {
        Objects.requireNonNull(remote, "remote");
        DatagramClient client = new DatagramClient(context.observabilitySink());
        Bootstrap b = bootstrap(context, remote, client);
        Channel ch = NettyFutures.await(b.connect(
                DatagramStream.toNettyAddress(remote),
                local == null ? null : DatagramStream.toNettyAddress(local)));
        client.attach(ch);
        return client;
    }

    /**
     * Adapt a socket the caller has already configured (broadcast flags,
     * multicast membership, reuse options) into a stream.
     *
     * <p>The result is a {@link DatagramClient} when the socket is connected to a
     * peer, otherwise a {@link DatagramServer}.</p>
     *
     * @throws IllegalArgumentException if {@code socket} is not a datagram channel,
     *         is neither bound nor connected, or is not an INET/INET6 socket
     */
    public static DatagramStream fromSocket(TransportContext context, NetworkChannel socket)
            throws IOException, InterruptedException
    {
        Objects.requireNonNull(socket, "socket");
        if (!(socket instanceof DatagramChannel datagramChannel)) {
            throw new IllegalArgumentException(
                    "socket type must be a datagram channel, got " + socket.getClass().getName());
        }

        SocketAddress local = datagramChannel.getLocalAddress();
        if (local == null) {
            throw new IllegalArgumentException("socket must be bound or connected before it is adapted");
        }
        if (!(local instanceof InetSocketAddress)) {
            throw new IllegalArgumentException(
                    "socket family not one of INET, INET6: " + local.getClass().getName());
        }

        CotObservabilitySink sink = context.observabilitySink();
        DatagramStream stream = datagramChannel.getRemoteAddress() != null
                ? new DatagramClient(sink)
                : new DatagramServer(sink);

        NioDatagramChannel ch = new NioDatagramChannel(datagramChannel);
        ch.pipeline().addLast(stream.handler());
        stream.attach(NettyFutures.await(context.eventLoopGroup().register(ch)));
        return stream;
    }

    private static Bootstrap bootstrap(TransportContext context, SocketAddress address, DatagramStream stream) {
        Bootstrap b = new Bootstrap();
        if (address instanceof UnixDomainSocketAddress) {
            b.group(context.domainEventLoopGroup()).channel(EpollDomainDatagramChannel.class);
        } else if (address instanceof InetSocketAddress) {
            b.group(context.eventLoopGroup()).channel(NioDatagramChannel.class);
        } else {
            throw new IllegalArgumentException("Unsupported address type: " + address.getClass().getName());
        }
        return b.handler(stream.handler());
    }
}
