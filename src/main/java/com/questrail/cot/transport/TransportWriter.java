package com.questrail.cot.transport;

import java.io.Closeable;

/**
 * Outbound half of a {@link TransportEndpoint}.
 *
 * <p>The transmit worker dispatches on the capability once per payload
 * without probing: a {@link StreamSink} gets write, drain, flush; a
 * {@link DatagramSink} gets a single send.</p>
 */
public sealed interface TransportWriter extends Closeable
        permits StreamSink, DatagramSink
{
}
