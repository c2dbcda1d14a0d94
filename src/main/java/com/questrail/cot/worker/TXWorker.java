package com.questrail.cot.worker;

import com.questrail.cot.codec.CodecException;
import com.questrail.cot.codec.TakProtoCodec;
import com.questrail.cot.config.CotConfig;
import com.questrail.cot.observability.CotObservabilitySink;
import com.questrail.cot.observability.CotWarningEvent;
import com.questrail.cot.transport.DatagramSink;
import com.questrail.cot.transport.StreamSink;
import com.questrail.cot.transport.TransportContext;
import com.questrail.cot.transport.TransportWriter;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;

/**
 * Drains the outbound queue into a transport writer.
 *
 * <p>Each item is transcoded to TAK protocol framing when binary framing is
 * active. A payload the codec rejects is sent untranscoded. Transport
 * failures propagate out of {@link #call()}.</p>
 */
public class TXWorker extends Worker
{
    private final TransportWriter writer;

    public TXWorker(BlockingQueue<byte[]> queue, CotConfig config, TransportWriter writer, TransportContext context) {
        super(queue, config, context);
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    public TXWorker(BlockingQueue<byte[]> queue,
                    CotConfig config,
                    TransportWriter writer,
                    TakProtoCodec codec,
                    CotObservabilitySink observabilitySink)
    {
        super(queue, config, codec, observabilitySink);
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    @Override
    protected void runOnce() throws IOException, InterruptedException {
        byte[] data = queue.take();
        handleData(data);
        compatDelay();
    }

    protected void handleData(byte[] data) throws IOException, InterruptedException {
        sendData(data);
    }

    /**
     * Write one payload using the writer's capability.
     */
    public void sendData(byte[] data) throws IOException, InterruptedException {
        if (data == null || data.length == 0) {
            warn("sendData called with empty data, skipping send.");
            return;
        }

        byte[] payload = data;
        if (format.isBinary()) {
            payload = transcode(data);
        }

        if (writer instanceof DatagramSink datagram) {
            datagram.send(payload);
        } else if (writer instanceof StreamSink stream) {
            stream.write(payload);
            stream.drain();
            stream.flush();
        }
    }

    private byte[] transcode(byte[] xml) {
        try {
            return codec().orElseThrow().xmlToProto(xml, format);
        } catch (CodecException e) {
            warn("Could not convert XML to Proto: " + e.getMessage());
            return xml;
        }
    }

    private void warn(String message) {
        observabilitySink.onWarning(new CotWarningEvent(Instant.now(), name(), message));
    }

    public TransportWriter writer() {
        return writer;
    }
}
