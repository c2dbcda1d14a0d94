package com.questrail.cot.runtime;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;

/**
 * The transmit and receive queues of one named endpoint.
 */
public record EndpointQueues(BlockingQueue<byte[]> txQueue, BlockingQueue<byte[]> rxQueue)
{
    public EndpointQueues {
        Objects.requireNonNull(txQueue, "txQueue");
        Objects.requireNonNull(rxQueue, "rxQueue");
    }
}
