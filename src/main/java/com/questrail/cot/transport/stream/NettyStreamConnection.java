package com.questrail.cot.transport.stream;

import com.questrail.cot.observability.CotObservabilitySink;
import com.questrail.cot.observability.CotTransportObservabilityEvent;
import com.questrail.cot.transport.DrainedSignal;
import com.questrail.cot.transport.NettyFutures;
import com.questrail.cot.transport.StreamSink;
import com.questrail.cot.transport.TransportClosedException;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;

import java.io.Closeable;
import java.io.IOException;
import java.time.Instant;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyStreamConnection
 * =============================================================================
 * One TCP (optionally TLS) connection exposed as a {@link StreamSink} writer
 * and a {@link BufferedStreamSource} reader.
 *
 * <p>The inbound handler is the only producer into the reader buffer. Write
 * failures and connection faults are recorded and raised by the next
 * {@link #drain()} or {@link #write(byte[])}.</p>
 */
public final class NettyStreamConnection implements StreamSink, Closeable
{
    private final BufferedStreamSource source;
    private final DrainedSignal drained = new DrainedSignal();
    private final Queue<Throwable> errors = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean closing = new AtomicBoolean(false);
    private final CotObservabilitySink observabilitySink;

    private volatile Channel channel;

    NettyStreamConnection(CotObservabilitySink observabilitySink) {
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.source = new BufferedStreamSource(BufferedStreamSource.DEFAULT_LIMIT, this::close);
    }

    public BufferedStreamSource source() {
        return source;
    }

    @Override
    public void write(byte[] data) throws IOException {
        Channel ch = requireOpen();
        raisePendingError();
        ch.write(Unpooled.wrappedBuffer(data)).addListener((ChannelFutureListener) this::recordWriteFailure);
    }

    @Override
    public void drain() throws IOException, InterruptedException {
        Channel ch = requireOpen();
        if (!ch.isWritable()) {
            // Pending bytes only leave the outbound buffer once flushed.
            ch.flush();
        }
        drained.await();
        raisePendingError();
        if (closing.get()) {
            throw new TransportClosedException("Connection lost");
        }
    }

    @Override
    public void flush() throws IOException {
        requireOpen().flush();
    }

    @Override
    public void close() {
        if (!closing.compareAndSet(false, true)) {
            return;
        }
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
        drained.set();
        source.close();
        observabilitySink.onTransportEvent(new CotTransportObservabilityEvent(
                Instant.now(), toString(), CotTransportObservabilityEvent.Kind.CLOSED, "closed by caller"));
    }

    public boolean isClosing() {
        return closing.get();
    }

    ChannelInboundHandlerAdapter handler() {
        return new InboundHandler();
    }

    void attach(Channel ch) {
        channel = ch;
        observabilitySink.onTransportEvent(new CotTransportObservabilityEvent(
                Instant.now(), toString(), CotTransportObservabilityEvent.Kind.OPENED, String.valueOf(ch)));
    }

    private Channel requireOpen() throws TransportClosedException {
        Channel ch = channel;
        if (closing.get() || ch == null) {
            throw new TransportClosedException();
        }
        return ch;
    }

    private void raisePendingError() throws IOException {
        Throwable error = errors.poll();
        if (error != null) {
            throw NettyFutures.asIOException(error);
        }
    }

    private void recordWriteFailure(ChannelFuture future) {
        if (!future.isSuccess() && !closing.get()) {
            errors.offer(future.cause());
        }
    }

    @Override
    public String toString() {
        Channel ch = channel;
        return ch == null
                ? "NettyStreamConnection[unattached]"
                : "NettyStreamConnection[" + ch.localAddress() + " -> " + ch.remoteAddress() + "]";
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Copies received bytes into the reader buffer. Runs on the channel's event loop.
     */
    private final class InboundHandler extends ChannelInboundHandlerAdapter
    {
        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg) {
            try {
                if (msg instanceof ByteBuf content) {
                    source.append(ByteBufUtil.getBytes(content));
                }
            } finally {
                ReferenceCountUtil.release(msg);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            errors.offer(cause);
            source.fail(NettyFutures.asIOException(cause));
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            closing.set(true);
            source.endOfStream();
            drained.set();
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
