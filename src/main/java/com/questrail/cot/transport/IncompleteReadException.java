package com.questrail.cot.transport;

import java.io.EOFException;

/**
 * The stream ended before the expected delimiter arrived.
 */
public final class IncompleteReadException extends EOFException
{
    private final byte[] partial;

    public IncompleteReadException(byte[] partial) {
        super(partial.length + " bytes read before end of stream");
        this.partial = partial.clone();
    }

    /** Bytes received after the last complete chunk. */
    public byte[] partial() {
        return partial.clone();
    }
}
