package com.questrail.cot.transport;

import com.questrail.cot.codec.TakProtoCodec;
import com.questrail.cot.observability.CotObservabilitySink;
import com.questrail.cot.observability.NullObservabilitySink;
import com.questrail.cot.transport.tls.CertificateEnrollment;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;

import java.io.Closeable;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * TransportContext
 * =============================================================================
 * Process-level collaborators shared by every transport and worker of a runtime.
 *
 * <p>Constructed once by the composition root and passed by reference. It owns
 * the Netty event loop that delivers all channel callbacks, so datagram and
 * stream handlers share one serialized execution context.</p>
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>{@link CotObservabilitySink}: logging and diagnostics</li>
 *   <li>{@link TakProtoCodec}: optional binary codec</li>
 *   <li>{@link CertificateEnrollment}: optional PKI enrollment client</li>
 *   <li>the NIO event loop group, and a lazily created epoll group for
 *       local-domain datagram sockets</li>
 * </ul>
 */
public final class TransportContext implements Closeable
{
    private final EventLoopGroup eventLoopGroup;
    private final boolean ownsEventLoopGroup;
    private final CotObservabilitySink observabilitySink;
    private final TakProtoCodec codec;
    private final CertificateEnrollment enrollment;

    private EventLoopGroup domainEventLoopGroup;

    private TransportContext(Builder b) {
        this.ownsEventLoopGroup = b.eventLoopGroup == null;
        this.eventLoopGroup = ownsEventLoopGroup ? new NioEventLoopGroup(b.eventLoopThreads) : b.eventLoopGroup;
        this.observabilitySink = b.observabilitySink;
        this.codec = b.codec;
        this.enrollment = b.enrollment;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A context with defaults: one event loop thread, no codec, no enrollment. */
    public static TransportContext defaults() {
        return builder().build();
    }

    public EventLoopGroup eventLoopGroup() {
        return eventLoopGroup;
    }

    /**
     * Event loop for local-domain datagram channels, which need the native epoll transport.
     *
     * @throws UnsupportedOperationException if native epoll is unavailable on this platform
     */
    public synchronized EventLoopGroup domainEventLoopGroup() {
        if (!Epoll.isAvailable()) {
            throw new UnsupportedOperationException(
                    "Local-domain datagram sockets need native epoll", Epoll.unavailabilityCause());
        }
        if (domainEventLoopGroup == null) {
            domainEventLoopGroup = new EpollEventLoopGroup(1);
        }
        return domainEventLoopGroup;
    }

    public CotObservabilitySink observabilitySink() {
        return observabilitySink;
    }

    public Optional<TakProtoCodec> codec() {
        return Optional.ofNullable(codec);
    }

    public Optional<CertificateEnrollment> enrollment() {
        return Optional.ofNullable(enrollment);
    }

    /**
     * Shut down the event loops this context created. Externally supplied groups are left running.
     */
    @Override
    public void close() {
        if (ownsEventLoopGroup) {
            eventLoopGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
        EventLoopGroup domain;
        synchronized (this) {
            domain = domainEventLoopGroup;
            domainEventLoopGroup = null;
        }
        if (domain != null) {
            domain.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
    }

    public static final class Builder {
        private EventLoopGroup eventLoopGroup;
        private int eventLoopThreads = 1;
        private CotObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private TakProtoCodec codec;
        private CertificateEnrollment enrollment;

        /** Use a caller-owned event loop group; {@link #close()} will not shut it down. */
        public Builder withEventLoopGroup(EventLoopGroup group) {
            this.eventLoopGroup = Objects.requireNonNull(group, "group");
            return this;
        }

        public Builder withEventLoopThreads(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("threads must be >= 1");
            }
            this.eventLoopThreads = threads;
            return this;
        }

        public Builder withObservabilitySink(CotObservabilitySink sink) {
            this.observabilitySink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public Builder withCodec(TakProtoCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder withEnrollment(CertificateEnrollment enrollment) {
            this.enrollment = enrollment;
            return this;
        }

        public TransportContext build() {
            return new TransportContext(this);
        }
    }
}
