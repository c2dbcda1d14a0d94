package com.questrail.cot.transport;

import java.io.IOException;

/**
 * A byte stream read in delimiter-terminated chunks.
 */
public non-sealed interface StreamSource extends TransportReader
{
    /**
     * Block until {@code delimiter} has been received and return everything up
     * to and including it.
     *
     * @throws IncompleteReadException if the stream ended before the delimiter;
     *         the exception carries the partial bytes
     * @throws TransportClosedException if the stream had already ended on a
     *         previous call
     * @throws IOException on a transport failure
     */
    byte[] readUntil(byte[] delimiter) throws IOException, InterruptedException;
}
