package com.questrail.cot.worker;

import com.questrail.cot.codec.CodecException;
import com.questrail.cot.codec.TakProtoCodec;
import com.questrail.cot.config.CotConfig;
import com.questrail.cot.config.CotConfigKeys;
import com.questrail.cot.observability.CotObservabilitySink;
import com.questrail.cot.transport.DatagramSource;
import com.questrail.cot.transport.IncompleteReadException;
import com.questrail.cot.transport.StreamSource;
import com.questrail.cot.transport.TransportContext;
import com.questrail.cot.transport.TransportReader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;

/**
 * Fills the inbound queue from a transport reader, one framed event per iteration.
 *
 * <p>Stream readers are framed on the closing {@code </event>} tag; datagram
 * readers yield one event per datagram. A stream that ends mid-event yields
 * no data. An endpoint without a reader parks this worker until it is
 * cancelled.</p>
 */
public class RXWorker extends Worker
{
    static final byte[] EVENT_END = "</event>".getBytes(StandardCharsets.UTF_8);

    private final TransportReader reader;
    private final CountDownLatch idle = new CountDownLatch(1);

    /**
     * @param reader may be {@code null} for write-only endpoints
     */
    public RXWorker(BlockingQueue<byte[]> queue, CotConfig config, TransportReader reader, TransportContext context) {
        super(queue, config, context);
        this.reader = reader;
    }

    public RXWorker(BlockingQueue<byte[]> queue,
                    CotConfig config,
                    TransportReader reader,
                    TakProtoCodec codec,
                    CotObservabilitySink observabilitySink)
    {
        super(queue, config, codec, observabilitySink);
        this.reader = reader;
    }

    @Override
    protected void runOnce() throws IOException, InterruptedException {
        if (reader == null) {
            idle.await();
            return;
        }
        Optional<byte[]> data = readEvent();
        if (data.isPresent() && data.get().length > 0) {
            log.debug("RX data: {}", new String(data.get(), StandardCharsets.UTF_8));
            putQueue(data.get());
        }
    }

    /**
     * Read one framed event.
     *
     * @return the event, or empty when the stream ended mid-event
     */
    public Optional<byte[]> readEvent() throws IOException, InterruptedException {
        byte[] frame;
        try {
            if (reader instanceof StreamSource stream) {
                frame = stream.readUntil(EVENT_END);
            } else if (reader instanceof DatagramSource datagram) {
                frame = datagram.recv().payload();
            } else {
                return Optional.empty();
            }
        } catch (IncompleteReadException e) {
            log.debug("Stream ended with {} unframed bytes", e.partial().length);
            return Optional.empty();
        }

        if (format.isBinary()) {
            frame = decode(frame);
        }
        return Optional.of(frame);
    }

    private byte[] decode(byte[] frame) {
        try {
            return codec().orElseThrow().protoToXml(frame);
        } catch (CodecException e) {
            // Not a TAK protocol frame; pass it on as received.
            return frame;
        }
    }

    @Override
    protected String capacitySetting() {
        return CotConfigKeys.MAX_IN_QUEUE;
    }

    public Optional<TransportReader> reader() {
        return Optional.ofNullable(reader);
    }
}
