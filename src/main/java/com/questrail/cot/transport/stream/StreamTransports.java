package com.questrail.cot.transport.stream;

import com.questrail.cot.config.TlsConfig;
import com.questrail.cot.transport.NettyFutures;
import com.questrail.cot.transport.TlsVerificationException;
import com.questrail.cot.transport.TransportContext;
import com.questrail.cot.transport.TransportEndpoint;
import com.questrail.cot.transport.tls.TlsContextFactory;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;
import io.netty.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds (reader, writer) pairs for the stream family: {@code tcp}, {@code tls},
 * {@code log} and {@code file}.
 */
public final class StreamTransports
{
    private static final Logger log = LoggerFactory.getLogger(StreamTransports.class);

    private StreamTransports() {}

    /**
     * Open a plain TCP connection.
     */
    public static TransportEndpoint connect(TransportContext context, String host, int port)
            throws IOException, InterruptedException
    {
        NettyStreamConnection connection = new NettyStreamConnection(context.observabilitySink());
        Channel ch = NettyFutures.await(bootstrap(context, connection, null).connect(host, port));
        connection.attach(ch);
        return new TransportEndpoint(connection.source(), connection, connection);
    }

    /**
     * Open a TLS connection and wait for the handshake.
     *
     * @throws TlsVerificationException if the server certificate is rejected
     */
    public static TransportEndpoint connectTls(TransportContext context,
                                               String host,
                                               int port,
                                               TlsConfig tls,
                                               SslContext sslContext,
                                               TlsContextFactory tlsFactory)
            throws IOException, InterruptedException
    {
        NettyStreamConnection connection = new NettyStreamConnection(context.observabilitySink());
        TlsSettings settings = new TlsSettings(tls, sslContext, tlsFactory, host, port);
        Channel ch = NettyFutures.await(bootstrap(context, connection, settings).connect(host, port));

        Future<Channel> handshake = ch.pipeline().get(SslHandler.class).handshakeFuture();
        handshake.await();
        if (!handshake.isSuccess()) {
            ch.close();
            Throwable cause = handshake.cause();
            Optional<TlsVerificationException> rejected = TlsContextFactory.verificationFailure(cause);
            if (rejected.isPresent()) {
                throw rejected.get();
            }
            throw NettyFutures.asIOException(cause);
        }

        SslHandler ssl = ch.pipeline().get(SslHandler.class);
        log.debug("TLS connection established: protocol={}, cipher={}",
                ssl.engine().getSession().getProtocol(), ssl.engine().getSession().getCipherSuite());

        connection.attach(ch);
        return new TransportEndpoint(connection.source(), connection, connection);
    }

    /**
     * Standard output, or standard error when {@code host} contains {@code stderr}.
     */
    public static TransportEndpoint log(String host) {
        boolean stderr = host != null && host.toLowerCase(Locale.ROOT).contains("stderr");
        OutputStream out = stderr ? System.err : System.out;
        return new TransportEndpoint(null, new OutputStreamSink(out, stderr ? "stderr" : "stdout", false));
    }

    /**
     * A file opened for writing, truncating existing content. Parent directories are created.
     */
    public static TransportEndpoint file(String path) throws IOException {
        Path file = Path.of(path);
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return new TransportEndpoint(null, new OutputStreamSink(Files.newOutputStream(file), file.toString(), true));
    }

    private static Bootstrap bootstrap(TransportContext context, NettyStreamConnection connection, TlsSettings tls) {
        return new Bootstrap()
                .group(context.eventLoopGroup())
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (tls != null) {
                            p.addLast(tls.factory().newHandler(tls.context(), tls.config(), ch.alloc(), tls.host(), tls.port()));
                        }
                        p.addLast(connection.handler());
                    }
                });
    }

    private record TlsSettings(TlsConfig config, SslContext context, TlsContextFactory factory, String host, int port) {}
}
