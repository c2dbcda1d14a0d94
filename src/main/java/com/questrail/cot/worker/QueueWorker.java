package com.questrail.cot.worker;

import com.questrail.cot.codec.TakProtoCodec;
import com.questrail.cot.config.CotConfig;
import com.questrail.cot.config.CotConfigKeys;
import com.questrail.cot.observability.CotObservabilitySink;
import com.questrail.cot.transport.TransportContext;

import java.util.concurrent.BlockingQueue;

/**
 * Base class for application producers.
 *
 * <p>A subclass turns some outside source (a feed, a sensor, a timer) into
 * CoT events in {@link #runOnce()} and admits them with
 * {@link #putQueue(byte[])}, whose drop-oldest policy keeps the most recent
 * events when the transmit side falls behind.</p>
 */
public abstract class QueueWorker extends Worker
{
    protected QueueWorker(BlockingQueue<byte[]> queue, CotConfig config, TransportContext context) {
        super(queue, config, context);
        logDestination();
    }

    protected QueueWorker(BlockingQueue<byte[]> queue,
                          CotConfig config,
                          TakProtoCodec codec,
                          CotObservabilitySink observabilitySink)
    {
        super(queue, config, codec, observabilitySink);
        logDestination();
    }

    private void logDestination() {
        log.info("Using COT_URL='{}'", config.get(CotConfigKeys.COT_URL).orElse(""));
    }

    /**
     * Process one item from the outside source. Admits it unchanged by default.
     */
    protected void handleData(byte[] data) throws InterruptedException {
        putQueue(data);
    }
}
