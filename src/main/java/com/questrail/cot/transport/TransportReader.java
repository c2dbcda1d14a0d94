package com.questrail.cot.transport;

import java.io.Closeable;

/**
 * Inbound half of a {@link TransportEndpoint}.
 *
 * <p>Exactly two capabilities exist: a byte stream that is framed by
 * delimiter, and a datagram source that yields one frame per receive.</p>
 */
public sealed interface TransportReader extends Closeable
        permits StreamSource, DatagramSource
{
}
