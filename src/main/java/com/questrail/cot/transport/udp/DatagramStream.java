package com.questrail.cot.transport.udp;

import com.questrail.cot.observability.CotObservabilitySink;
import com.questrail.cot.observability.CotTransportObservabilityEvent;
import com.questrail.cot.transport.Datagram;
import com.questrail.cot.transport.DatagramSource;
import com.questrail.cot.transport.DrainedSignal;
import com.questrail.cot.transport.TransportClosedException;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.AddressedEnvelope;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.unix.DomainSocketAddress;
import io.netty.util.ReferenceCountUtil;

import java.io.IOException;
import java.net.SocketAddress;
import java.net.UnixDomainSocketAddress;
import java.time.Instant;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DatagramStream
 * =============================================================================
 * One UDP (or local-domain datagram) socket wrapped as a blocking send/receive
 * object.
 *
 * <h2>Shared state</h2>
 * <ul>
 *   <li><b>inbound</b>: received datagrams, plus a close sentinel that
 *       unblocks a waiting receiver</li>
 *   <li><b>errors</b>: transport faults, raised lazily by the next call</li>
 *   <li><b>drained</b>: set while the channel is writable; senders wait on it</li>
 * </ul>
 *
 * <p>Two flavors exist: {@link DatagramClient} is connected to one peer and
 * sends without an address; {@link DatagramServer} is bound locally and needs
 * a destination per send. Instances are created by {@link DatagramStreams}.</p>
 */
public abstract class DatagramStream implements DatagramSource
{
    /** Identity sentinel queued when the transport goes away. */
    private static final Datagram CLOSED = new Datagram(new byte[0], null);

    private final BlockingQueue<Datagram> inbound = new LinkedBlockingQueue<>();
    private final Queue<Throwable> errors = new ConcurrentLinkedQueue<>();
    private final DrainedSignal drained = new DrainedSignal();
    private final AtomicBoolean closing = new AtomicBoolean(false);
    private final CotObservabilitySink observabilitySink;

    private volatile Channel channel;

    DatagramStream(CotObservabilitySink observabilitySink) {
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * Receive one datagram.
     *
     * @throws TransportClosedException if the stream is closed, or closes while waiting
     * @throws IOException if an earlier operation failed on the socket
     */
    @Override
    public Datagram recv() throws IOException, InterruptedException {
        requireOpen();
        raisePendingError();

        Datagram datagram = inbound.take();
        if (datagram == CLOSED) {
            throw new TransportClosedException();
        }
        return datagram;
    }

    /**
     * Close the socket. Idempotent.
     */
    @Override
    public void close() {
        if (!closing.compareAndSet(false, true)) {
            return;
        }
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
        inbound.offer(CLOSED);
        drained.set();
        observabilitySink.onTransportEvent(new CotTransportObservabilityEvent(
                Instant.now(), toString(), CotTransportObservabilityEvent.Kind.CLOSED, "closed by caller"));
    }

    public boolean isClosing() {
        return closing.get();
    }

    public SocketAddress localAddress() {
        Channel ch = channel;
        return ch == null ? null : toJdkAddress(ch.localAddress());
    }

    public SocketAddress remoteAddress() {
        Channel ch = channel;
        return ch == null ? null : toJdkAddress(ch.remoteAddress());
    }

    /**
     * Write one message and wait until the channel is writable again.
     */
    final void writeAndAwaitDrain(Object message) throws IOException, InterruptedException {
        Channel ch = requireOpen();
        raisePendingError();

        ch.writeAndFlush(message).addListener((ChannelFutureListener) this::recordWriteFailure);
        drained.await();
    }

    final Channel requireOpen() throws TransportClosedException {
        Channel ch = channel;
        if (closing.get() || ch == null) {
            throw new TransportClosedException();
        }
        return ch;
    }

    private void raisePendingError() throws IOException {
        Throwable error = errors.poll();
        if (error != null) {
            throw new IOException("Datagram transport error: " + error, error);
        }
    }

    private void recordWriteFailure(ChannelFuture future) {
        if (!future.isSuccess() && !closing.get()) {
            errors.offer(future.cause());
        }
    }

    ChannelInboundHandlerAdapter handler() {
        return new InboundHandler();
    }

    void attach(Channel ch) {
        Channel previous = channel;
        if (previous != null && previous != ch) {
            reportReplaced(previous, ch);
        }
        channel = ch;
        observabilitySink.onTransportEvent(new CotTransportObservabilityEvent(
                Instant.now(), toString(), CotTransportObservabilityEvent.Kind.OPENED, String.valueOf(ch)));
    }

    private void reportReplaced(Channel previous, Channel next) {
        observabilitySink.onTransportEvent(new CotTransportObservabilityEvent(
                Instant.now(), toString(), CotTransportObservabilityEvent.Kind.REPLACED,
                "unexpected second transport " + next + " (was " + previous + ")"));
    }

    static SocketAddress toJdkAddress(SocketAddress address) {
        if (address instanceof DomainSocketAddress domain) {
            return domain.path().isEmpty() ? null : UnixDomainSocketAddress.of(domain.path());
        }
        return address;
    }

    static SocketAddress toNettyAddress(SocketAddress address) {
        if (address instanceof UnixDomainSocketAddress unix) {
            return new DomainSocketAddress(unix.getPath().toString());
        }
        return address;
    }

    @Override
    public String toString() {
        Channel ch = channel;
        String name = getClass().getSimpleName();
        if (ch == null) {
            return name + "[unattached]";
        }
        return name + "[" + toJdkAddress(ch.localAddress()) + " -> " + toJdkAddress(ch.remoteAddress()) + "]";
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * The single writer into this stream's queues. Runs on the channel's event loop.
     */
    private final class InboundHandler extends ChannelInboundHandlerAdapter
    {
        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception {
            Channel previous = channel;
            if (previous != null && previous != ctx.channel()) {
                reportReplaced(previous, ctx.channel());
            }
            channel = ctx.channel();
            super.channelActive(ctx);
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg) {
            try {
                if (msg instanceof AddressedEnvelope<?, ?> envelope && envelope.content() instanceof ByteBuf content) {
                    // Copy the payload into a plain byte[] (Netty containment rule).
                    byte[] bytes = ByteBufUtil.getBytes(content);
                    inbound.offer(new Datagram(bytes, toJdkAddress(envelope.sender())));
                }
            } finally {
                ReferenceCountUtil.release(msg);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            // UDP faults are reported on a later call; the channel stays open.
            errors.offer(cause);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            closing.set(true);
            inbound.offer(CLOSED);
            drained.set();
            channel = null;
            super.channelInactive(ctx);
        }

        @Override
        public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
            if (ctx.channel().isWritable()) {
                drained.set();
            } else {
                drained.clear();
            }
            super.channelWritabilityChanged(ctx);
        }
    }
}
