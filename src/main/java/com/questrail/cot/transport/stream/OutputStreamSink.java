package com.questrail.cot.transport.stream;

import com.questrail.cot.transport.StreamSink;
import com.questrail.cot.transport.TransportClosedException;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * {@link StreamSink} over a blocking {@link OutputStream}, used by the {@code log}
 * and {@code file} destinations. Writes complete synchronously, so {@link #drain()}
 * only checks that the sink is still open.
 */
public final class OutputStreamSink implements StreamSink
{
    private final OutputStream out;
    private final String name;
    private final boolean owned;

    private volatile boolean closed;

    /**
     * @param owned whether {@link #close()} closes {@code out}; process streams are left open
     */
    public OutputStreamSink(OutputStream out, String name, boolean owned) {
        this.out = Objects.requireNonNull(out, "out");
        this.name = Objects.requireNonNull(name, "name");
        this.owned = owned;
    }

    @Override
    public synchronized void write(byte[] data) throws IOException {
        requireOpen();
        out.write(data);
    }

    @Override
    public void drain() throws IOException {
        requireOpen();
    }

    @Override
    public synchronized void flush() throws IOException {
        requireOpen();
        out.flush();
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (owned) {
            out.close();
        } else {
            out.flush();
        }
    }

    private void requireOpen() throws TransportClosedException {
        if (closed) {
            throw new TransportClosedException(name + " is closed");
        }
    }

    @Override
    public String toString() {
        return "OutputStreamSink[" + name + "]";
    }
}
