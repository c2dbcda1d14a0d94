package com.questrail.cot.transport;

import java.io.IOException;

/**
 * Raised when an operation is attempted on, or interrupted by, a closed transport.
 */
public final class TransportClosedException extends IOException
{
    public TransportClosedException() {
        super("Transport closed");
    }

    public TransportClosedException(String message) {
        super(message);
    }
}
