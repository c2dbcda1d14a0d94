package com.questrail.cot.transport;

import java.io.IOException;

/**
 * A byte stream written with explicit flow control.
 */
public non-sealed interface StreamSink extends TransportWriter
{
    /** Queue {@code data} for transmission. */
    void write(byte[] data) throws IOException;

    /**
     * Block until the outbound buffer is below its high-water mark.
     *
     * @throws IOException if an earlier write failed or the stream was lost
     */
    void drain() throws IOException, InterruptedException;

    void flush() throws IOException;
}
