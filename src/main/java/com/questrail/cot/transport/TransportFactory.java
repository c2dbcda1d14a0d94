package com.questrail.cot.transport;

import com.questrail.cot.codec.ProtocolFormat;
import com.questrail.cot.config.CotConfig;
import com.questrail.cot.config.CotConfigurationException;
import com.questrail.cot.config.CotUrl;
import com.questrail.cot.config.TlsConfig;
import com.questrail.cot.transport.stream.StreamTransports;
import com.questrail.cot.transport.tls.TlsContextFactory;
import com.questrail.cot.transport.udp.UdpTransports;
import com.questrail.cot.worker.RXWorker;
import com.questrail.cot.worker.TXWorker;

import io.netty.handler.ssl.SslContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;

/**
 * TransportFactory
 * =============================================================================
 * Builds the {@link TransportEndpoint} for one destination from its
 * {@link CotConfig}.
 *
 * <table>
 *   <caption>Reader and writer per scheme</caption>
 *   <tr><th>scheme</th><th>reader</th><th>writer</th></tr>
 *   <tr><td>tcp</td><td>stream</td><td>stream</td></tr>
 *   <tr><td>tls, ssl</td><td>stream</td><td>stream (TLS)</td></tr>
 *   <tr><td>udp[+broadcast][+multicast]</td><td>datagram server</td><td>datagram client</td></tr>
 *   <tr><td>udp+wo</td><td>absent</td><td>datagram client</td></tr>
 *   <tr><td>log, file</td><td>absent</td><td>stream</td></tr>
 * </table>
 *
 * <p>Configuration problems surface as {@link CotConfigurationException}
 * before any socket is opened. Connection failures surface as
 * {@link IOException}.</p>
 */
public final class TransportFactory
{
    private static final Logger log = LoggerFactory.getLogger(TransportFactory.class);

    private final TransportContext context;
    private final TlsContextFactory tlsFactory;

    public TransportFactory(TransportContext context) {
        this.context = Objects.requireNonNull(context, "context");
        this.tlsFactory = new TlsContextFactory(context.observabilitySink());
    }

    public TransportEndpoint create(CotConfig config) throws IOException, InterruptedException {
        Objects.requireNonNull(config, "config");

        CotUrl url = CotUrl.parse(config.cotUrl());
        // Binary framing without a codec is rejected before anything is opened.
        ProtocolFormat.resolve(config, context.codec().orElse(null));

        log.debug("Opening {} for {}", url, config.name());

        if (url.isTcp()) {
            return StreamTransports.connect(context, url.host(), url.port());
        }
        if (url.isTls()) {
            return openTls(config, url);
        }
        if (url.isUdp()) {
            return UdpTransports.open(context, url, config);
        }
        if (url.isLog()) {
            return StreamTransports.log(url.host());
        }
        if (url.isFile()) {
            return StreamTransports.file(url.filePath());
        }
        throw new CotConfigurationException("Invalid COT_URL protocol specified: " + url);
    }

    private TransportEndpoint openTls(CotConfig config, CotUrl url) throws IOException, InterruptedException {
        TlsConfig tls = TlsConfig.from(config);
        SslContext sslContext = tlsFactory.newClientContext(tls, url.host(), context.enrollment());
        return StreamTransports.connectTls(context, url.host(), url.port(), tls, sslContext, tlsFactory);
    }

    /**
     * Opens the endpoint for {@code config} and wraps its writer in a {@link TXWorker}.
     */
    public TXWorker txWorker(BlockingQueue<byte[]> queue, CotConfig config) throws IOException, InterruptedException {
        TransportEndpoint endpoint = create(config);
        return new TXWorker(queue, config, endpoint.writer().orElse(null), context);
    }

    /**
     * Opens the endpoint for {@code config} and wraps its reader in an {@link RXWorker}.
     */
    public RXWorker rxWorker(BlockingQueue<byte[]> queue, CotConfig config) throws IOException, InterruptedException {
        TransportEndpoint endpoint = create(config);
        return new RXWorker(queue, config, endpoint.reader().orElse(null), context);
    }

    public TransportContext context() {
        return context;
    }
}
